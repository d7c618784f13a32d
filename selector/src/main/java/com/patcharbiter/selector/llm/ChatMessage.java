package com.patcharbiter.selector.llm;

import java.util.List;

/**
 * A message in a running conversation.
 *
 * Assistant messages may carry tool calls; a user message may instead carry
 * the result of one tool call ({@code toolResult}).
 */
public record ChatMessage(Role role, String content, List<ToolCall> toolCalls, ToolResultBlock toolResult) {

    public enum Role { SYSTEM, USER, ASSISTANT }

    /** The outcome of one tool call, addressed to the call that requested it. */
    public record ToolResultBlock(String callId, String toolName, boolean success, String output) {}

    public ChatMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(Role.SYSTEM, content, List.of(), null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content, List.of(), null);
    }

    public static ChatMessage assistant(ChatResponse response) {
        return new ChatMessage(Role.ASSISTANT, response.content(), response.toolCalls(), null);
    }

    public static ChatMessage toolResult(ToolCall call, boolean success, String output) {
        return new ChatMessage(Role.USER, output, List.of(),
                new ToolResultBlock(call.id(), call.name(), success, output));
    }
}
