package com.patcharbiter.selector.tool;

/**
 * A tool call argument has a shape that cannot be passed on a command line.
 * Reported back to the model as a failed call; the episode goes on.
 */
public class ToolArgumentException extends RuntimeException {

    public ToolArgumentException(String message) {
        super(message);
    }
}
