package com.patcharbiter.selector.tool;

public class ToolNotFoundException extends RuntimeException {
    public ToolNotFoundException(String name) {
        super("No tool registered with name: '" + name + "'");
    }
}
