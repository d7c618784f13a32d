package com.patcharbiter.selector.agent;

import com.patcharbiter.selector.model.Instance;
import com.patcharbiter.selector.model.WorkingSet;

import java.nio.file.Path;

/**
 * Input of one selection episode.
 *
 * @param round          1-based voting round, used for logging
 * @param trajectoryFile where the conversation is recorded
 */
public record EpisodeRequest(Instance instance, WorkingSet workingSet, int round, Path trajectoryFile) {
}
