package com.patcharbiter.selector.model;

import java.util.List;

/**
 * The deduplicated candidates an episode chooses between. Display ids are
 * 1-based positions in this list; the agent only ever sees display ids.
 */
public record WorkingSet(List<CandidatePatch> candidates) {

    public WorkingSet {
        candidates = List.copyOf(candidates);
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("A working set needs at least one candidate");
        }
    }

    public int size() {
        return candidates.size();
    }

    public CandidatePatch first() {
        return candidates.get(0);
    }

    public CandidatePatch byDisplayId(int displayId) {
        return candidates.get(displayId - 1);
    }

    /**
     * Resolve the token the agent wrote after {@code Patch-}. Anything other
     * than an exact display id in {@code 1..size} falls back to the first
     * candidate.
     */
    public CandidatePatch resolveSelection(String token) {
        for (int displayId = 1; displayId <= candidates.size(); displayId++) {
            if (String.valueOf(displayId).equals(token)) {
                return byDisplayId(displayId);
            }
        }
        return first();
    }

    public boolean isValidSelection(String token) {
        for (int displayId = 1; displayId <= candidates.size(); displayId++) {
            if (String.valueOf(displayId).equals(token)) {
                return true;
            }
        }
        return false;
    }
}
