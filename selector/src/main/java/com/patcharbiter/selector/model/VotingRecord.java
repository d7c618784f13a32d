package com.patcharbiter.selector.model;

/** One episode's vote inside a consensus run. Rounds are 1-based. */
public record VotingRecord(int round, int chosenId, String patchText) {
}
