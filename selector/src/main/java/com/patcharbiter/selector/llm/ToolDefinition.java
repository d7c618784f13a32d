package com.patcharbiter.selector.llm;

import java.util.Map;

/** A tool offered to the model, described by a JSON schema for its input. */
public record ToolDefinition(String name, String description, Map<String, Object> inputSchema) {
}
