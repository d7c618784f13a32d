package com.patcharbiter.selector.model;

import java.util.List;

/**
 * A fixed-size slice of an instance's candidate list. Each group is
 * processed, retried and checkpointed on its own.
 */
public record CandidateGroup(
        String             instanceId,
        int                groupId,
        List<String>       patches,
        List<List<String>> regressions,
        List<Integer>      successIds) {

    public CandidateGroup {
        patches = List.copyOf(patches);
        regressions = List.copyOf(regressions);
        successIds = List.copyOf(successIds);
        if (patches.size() != regressions.size() || patches.size() != successIds.size()) {
            throw new IllegalArgumentException("Group " + groupId + " of " + instanceId
                    + " has mismatched patch/regression/success lengths");
        }
    }

    public int size() {
        return patches.size();
    }

    /** True when every candidate in the group is known to resolve the issue. */
    public boolean isAllSuccess() {
        return !successIds.isEmpty() && successIds.stream().allMatch(id -> id == 1);
    }

    /** True when no candidate in the group resolves the issue. */
    public boolean isAllFailed() {
        return successIds.stream().noneMatch(id -> id == 1);
    }
}
