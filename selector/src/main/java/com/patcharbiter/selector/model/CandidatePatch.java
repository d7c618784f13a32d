package com.patcharbiter.selector.model;

/**
 * One candidate inside a group's episode.
 *
 * @param id                 group-local index in the original candidate order (0-based)
 * @param rawDiff            the diff exactly as proposed
 * @param signature          comment/whitespace-insensitive fingerprint of the diff
 * @param regressionClean    true when the regression run reported no newly failing tests
 * @param groundTruthSuccess bookkeeping only; never shown to the agent
 */
public record CandidatePatch(
        int     id,
        String  rawDiff,
        String  signature,
        boolean regressionClean,
        boolean groundTruthSuccess) {
}
