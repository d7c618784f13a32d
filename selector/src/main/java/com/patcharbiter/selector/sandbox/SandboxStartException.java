package com.patcharbiter.selector.sandbox;

/**
 * The container could not be brought up. Fatal for the current attempt;
 * the group scheduler retries with a fresh sandbox.
 */
public class SandboxStartException extends SandboxException {

    public SandboxStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
