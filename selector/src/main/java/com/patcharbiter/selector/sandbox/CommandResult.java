package com.patcharbiter.selector.sandbox;

/** Exit code and merged stdout/stderr of a finished host command. */
public record CommandResult(int exitCode, String output) {

    public boolean success() {
        return exitCode == 0;
    }
}
