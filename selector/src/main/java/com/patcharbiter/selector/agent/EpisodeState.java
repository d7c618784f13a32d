package com.patcharbiter.selector.agent;

/** Where a selection episode is in its conversation. */
public enum EpisodeState {
    INIT,
    THINKING,
    WAITING_ON_TOOL,
    /** The agent reported a selection (possibly an invalid one). */
    DECIDED,
    /** Turn budget used up without a report. */
    EXHAUSTED
}
