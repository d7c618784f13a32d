package com.patcharbiter.selector.claude;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.patcharbiter.selector.llm.ChatClient;
import com.patcharbiter.selector.llm.ChatClientException;
import com.patcharbiter.selector.llm.ChatMessage;
import com.patcharbiter.selector.llm.ChatResponse;
import com.patcharbiter.selector.llm.ToolCall;
import com.patcharbiter.selector.llm.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ChatClient} over the Anthropic Messages API.
 *
 * Raw {@link HttpClient} rather than an SDK: the request is a single JSON
 * document and we want to see exactly what goes over the wire. Rate limits
 * and server errors are retried with exponential backoff.
 */
@Component
public class ClaudeClient implements ChatClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       baseUrl;
    private final String       model;
    private final int          maxTokens;
    private final Duration     requestTimeout;
    private final int          maxRetries;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                        @Value("${anthropic.model}") String model,
                        @Value("${anthropic.max-tokens:4096}") int maxTokens,
                        @Value("${anthropic.request-timeout:180s}") Duration requestTimeout,
                        @Value("${anthropic.max-retries:3}") int maxRetries,
                        ObjectMapper objectMapper) {
        this.apiKey         = apiKey;
        this.baseUrl        = baseUrl;
        this.model          = model;
        this.maxTokens      = maxTokens;
        this.requestTimeout = requestTimeout;
        this.maxRetries     = maxRetries;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // ChatClient
    // -------------------------------------------------------------------------

    @Override
    public ChatResponse chat(List<ChatMessage> messages, List<ToolDefinition> tools) {
        String body = requestBody(messages, tools).toString();
        int attempt = 0;
        while (true) {
            try {
                return send(body);
            } catch (ChatClientException e) {
                if (!e.isRetryable() || attempt >= maxRetries) {
                    throw e;
                }
                long backoffMs = 2000L << attempt;
                attempt++;
                log.warn("Chat request failed ({}), retry {}/{} in {} ms",
                        e.getMessage(), attempt, maxRetries, backoffMs);
                sleep(backoffMs);
            }
        }
    }

    @Override
    public String model() {
        return model;
    }

    // -------------------------------------------------------------------------
    // Request / response mapping
    // -------------------------------------------------------------------------

    /**
     * Build the Messages API request. System messages go to the top-level
     * {@code system} field; consecutive messages of one role are merged into
     * a single turn so that tool results for parallel calls arrive together.
     */
    ObjectNode requestBody(List<ChatMessage> messages, List<ToolDefinition> tools) {
        ObjectNode root = json.createObjectNode();
        root.put("model", model);
        root.put("max_tokens", maxTokens);

        StringBuilder system = new StringBuilder();
        ArrayNode turns = root.putArray("messages");
        ChatMessage.Role lastRole = null;
        ArrayNode blocks = null;

        for (ChatMessage message : messages) {
            if (message.role() == ChatMessage.Role.SYSTEM) {
                if (!system.isEmpty()) system.append("\n\n");
                system.append(message.content());
                continue;
            }
            if (message.role() != lastRole) {
                ObjectNode turn = turns.addObject();
                turn.put("role", message.role() == ChatMessage.Role.ASSISTANT ? "assistant" : "user");
                blocks = turn.putArray("content");
                lastRole = message.role();
            }
            appendBlocks(blocks, message);
        }
        if (!system.isEmpty()) {
            root.put("system", system.toString());
        }

        if (!tools.isEmpty()) {
            ArrayNode toolArray = root.putArray("tools");
            for (ToolDefinition tool : tools) {
                ObjectNode node = toolArray.addObject();
                node.put("name", tool.name());
                node.put("description", tool.description());
                node.set("input_schema", json.valueToTree(tool.inputSchema()));
            }
        }
        return root;
    }

    private void appendBlocks(ArrayNode blocks, ChatMessage message) {
        if (message.toolResult() != null) {
            ChatMessage.ToolResultBlock result = message.toolResult();
            ObjectNode block = blocks.addObject();
            block.put("type", "tool_result");
            block.put("tool_use_id", result.callId());
            block.put("content", result.output().isEmpty() ? "(no output)" : result.output());
            block.put("is_error", !result.success());
            return;
        }
        // The API rejects empty content, which a tool-less blank reply would produce.
        if (!message.content().isBlank() || message.toolCalls().isEmpty()) {
            ObjectNode text = blocks.addObject();
            text.put("type", "text");
            text.put("text", message.content().isBlank() ? "(empty)" : message.content());
        }
        for (ToolCall call : message.toolCalls()) {
            ObjectNode use = blocks.addObject();
            use.put("type", "tool_use");
            use.put("id", call.id());
            use.put("name", call.name());
            use.set("input", call.arguments() == null ? json.createObjectNode() : call.arguments());
        }
    }

    /** Map the response's content blocks onto the provider-neutral response. */
    ChatResponse parseResponse(String responseBody) throws IOException {
        JsonNode root = json.readTree(responseBody);
        StringBuilder text = new StringBuilder();
        List<ToolCall> calls = new ArrayList<>();
        for (JsonNode block : root.path("content")) {
            switch (block.path("type").asText()) {
                case "text" -> {
                    if (!text.isEmpty()) text.append("\n");
                    text.append(block.path("text").asText());
                }
                case "tool_use" -> calls.add(new ToolCall(
                        block.path("id").asText(),
                        block.path("name").asText(),
                        block.path("input")));
                default -> log.debug("Ignoring content block of type {}", block.path("type").asText());
            }
        }
        String stopReason = root.path("stop_reason").isMissingNode() ? null : root.path("stop_reason").asText();
        return new ChatResponse(text.toString(), calls, stopReason);
    }

    // -------------------------------------------------------------------------
    // Transport
    // -------------------------------------------------------------------------

    private ChatResponse send(String body) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/messages"))
                .timeout(requestTimeout)
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ChatClientException(response.statusCode(), response.body());
            }
            return parseResponse(response.body());
        } catch (IOException e) {
            throw new ChatClientException("Chat API call failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatClientException("Interrupted during chat API call", e, false);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatClientException("Interrupted while backing off", e, false);
        }
    }
}
