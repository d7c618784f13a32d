package com.patcharbiter.selector.tool;

/**
 * Outcome of one tool call as reported back to the model.
 *
 * @param output what the tool printed (may be present on failure too)
 * @param error  failure description, null on success
 */
public record ToolResult(boolean success, String output, String error) {

    public static ToolResult ok(String output) {
        return new ToolResult(true, output, null);
    }

    public static ToolResult failed(String error) {
        return new ToolResult(false, error, error);
    }

    public static ToolResult failed(String output, String error) {
        return new ToolResult(false, output, error);
    }

    /** The text the model reads on its next turn. */
    public String toObservation() {
        if (output != null && !output.isEmpty()) {
            return output;
        }
        return error != null ? error : "";
    }
}
