package com.patcharbiter.selector.llm;

import java.util.List;

/**
 * One assistant turn.
 *
 * @param content      concatenated text blocks, empty when the model only called tools
 * @param toolCalls    requested tool invocations, in order
 * @param finishReason provider stop reason, e.g. "end_turn" or "tool_use"
 */
public record ChatResponse(String content, List<ToolCall> toolCalls, String finishReason) {

    public ChatResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
