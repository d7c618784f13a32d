package com.patcharbiter.selector.agent;

import com.patcharbiter.selector.model.CandidatePatch;

/**
 * Outcome of one selection episode.
 *
 * @param chosen the selected candidate; the first working candidate when the
 *               agent never made a valid selection
 * @param state  {@link EpisodeState#DECIDED} or {@link EpisodeState#EXHAUSTED}
 * @param turns  model turns used
 */
public record EpisodeResult(CandidatePatch chosen, EpisodeState state, int turns) {
}
