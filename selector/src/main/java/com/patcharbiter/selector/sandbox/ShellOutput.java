package com.patcharbiter.selector.sandbox;

/**
 * What one shell command printed.
 *
 * A timed-out command is not an error: {@code text} then holds an
 * observation describing the timeout plus whatever output arrived, and the
 * session that produced it must be replaced before the next command.
 */
public record ShellOutput(String text, boolean timedOut) {

    public static ShellOutput completed(String text) {
        return new ShellOutput(text, false);
    }

    public static ShellOutput timedOut(String command, long timeoutSeconds, String partialOutput) {
        return new ShellOutput("### Observation: Error: Command '" + command + "' timed out after "
                + timeoutSeconds + " seconds. Partial output:\n" + partialOutput, true);
    }
}
