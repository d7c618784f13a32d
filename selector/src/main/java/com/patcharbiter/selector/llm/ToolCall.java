package com.patcharbiter.selector.llm;

import com.fasterxml.jackson.databind.JsonNode;

/** A tool invocation requested by the model; {@code arguments} is a JSON object. */
public record ToolCall(String id, String name, JsonNode arguments) {
}
