package com.patcharbiter.selector.tool;

import java.time.Duration;

/**
 * Execution constraints for one tool.
 *
 * @param commandTimeoutSec wall-clock limit of one invocation inside the sandbox shell
 */
public record ToolPolicy(int commandTimeoutSec) {

    public Duration commandTimeout() {
        return Duration.ofSeconds(commandTimeoutSec);
    }
}
