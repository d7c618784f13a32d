package com.patcharbiter.selector.sandbox;

import java.io.IOException;
import java.util.List;

/**
 * Spawns the long-lived interactive shell process behind a {@link ShellSession}.
 */
@FunctionalInterface
public interface ShellLauncher {

    Process launch(List<String> command) throws IOException;

    /** Launches with stderr merged into stdout, which is what session framing expects. */
    static ShellLauncher processBuilder() {
        return command -> new ProcessBuilder(command).redirectErrorStream(true).start();
    }
}
