package com.patcharbiter.selector.model;

/** How a group ended in one scheduler pass. */
public enum GroupOutcome {
    /** A statistics checkpoint already existed. */
    SKIPPED,
    /** All candidates succeed or all fail; no agent was needed. */
    TRIVIAL,
    /** A candidate was chosen and the checkpoint written. */
    SELECTED,
    /** Every attempt failed; nothing was written so a later run retries it. */
    UNRESOLVED
}
