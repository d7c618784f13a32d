package com.patcharbiter.selector.sandbox;

import java.time.Duration;
import java.util.List;

/**
 * Runs a host command to completion. Used for every docker CLI call.
 */
public interface CommandRunner {

    /**
     * @throws SandboxException if the command cannot be started, is
     *         interrupted, or does not finish within {@code timeout}
     */
    CommandResult run(List<String> command, Duration timeout);
}
