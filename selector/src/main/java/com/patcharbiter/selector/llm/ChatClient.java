package com.patcharbiter.selector.llm;

import java.util.List;

/**
 * The model behind the selector agent. Stateless: every call carries the
 * whole conversation.
 */
public interface ChatClient {

    /**
     * @throws ChatClientException when the provider rejects the request or
     *         cannot be reached after the adapter's own retries
     */
    ChatResponse chat(List<ChatMessage> messages, List<ToolDefinition> tools);

    /** Model identifier, recorded in trajectories. */
    String model();
}
