package com.patcharbiter.selector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All candidate patches proposed for one instance, as read from one line of
 * the candidate log.
 *
 * <p>{@code regressions.get(i)} lists the tests that newly fail with
 * {@code patches.get(i)} applied; {@code successIds.get(i)} is the ground
 * truth (1 = the patch resolves the issue).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CandidateLog(
        @JsonProperty("instance_id") String instanceId,
        @JsonProperty("issue")       String issue,
        @JsonProperty("patches")     List<String> patches,
        @JsonProperty("regressions") List<List<String>> regressions,
        @JsonProperty("success_id")  List<Integer> successIds) {

    public CandidateLog {
        patches = patches == null ? List.of() : List.copyOf(patches);
        regressions = padded(regressions, patches.size(), List.of());
        successIds = padded(successIds, patches.size(), 0);
    }

    /**
     * Slice the first {@code numCandidate} patches into groups of
     * {@code groupSize}. Group ids are 0-based in slice order.
     */
    public List<CandidateGroup> groups(int numCandidate, int groupSize) {
        if (groupSize <= 0) {
            throw new IllegalArgumentException("groupSize must be positive: " + groupSize);
        }
        int limit = Math.min(numCandidate, patches.size());
        List<CandidateGroup> groups = new ArrayList<>();
        for (int from = 0, groupId = 0; from < limit; from += groupSize, groupId++) {
            int to = Math.min(from + groupSize, limit);
            groups.add(new CandidateGroup(
                    instanceId,
                    groupId,
                    patches.subList(from, to),
                    regressions.subList(from, to),
                    successIds.subList(from, to)));
        }
        return groups;
    }

    private static <T> List<T> padded(List<T> values, int size, T filler) {
        List<T> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            T value = values != null && i < values.size() ? values.get(i) : null;
            result.add(value == null ? filler : value);
        }
        return Collections.unmodifiableList(result);
    }
}
