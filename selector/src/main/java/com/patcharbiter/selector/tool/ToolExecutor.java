package com.patcharbiter.selector.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Executes a named tool with a JSON argument object. Tool-level problems
 * (unknown tool, bad arguments, timeouts) come back as failed results, not
 * exceptions.
 */
public interface ToolExecutor {

    ToolResult execute(String toolName, JsonNode arguments);
}
