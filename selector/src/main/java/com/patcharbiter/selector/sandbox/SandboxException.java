package com.patcharbiter.selector.sandbox;

/**
 * Thrown when the container runtime or the shell inside it fails.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
