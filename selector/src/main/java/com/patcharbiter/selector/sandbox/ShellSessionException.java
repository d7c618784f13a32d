package com.patcharbiter.selector.sandbox;

/**
 * The interactive shell exited or could not be written to. The container is
 * still usable: open a new session against it.
 */
public class ShellSessionException extends SandboxException {

    public ShellSessionException(String message) {
        super(message);
    }

    public ShellSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
