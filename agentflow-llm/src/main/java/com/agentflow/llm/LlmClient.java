package com.agentflow.llm;

import java.util.List;
import java.util.Map;

/**
 * Provider-neutral model client. Provider-specific retry and backoff belong to the implementation.
 * Implementations must be safe for concurrent use by fork-join branches.
 */
public interface LlmClient {

    /**
     * Chat call with tools bound. The response may request tool calls.
     *
     * @throws LlmException when the provider call fails
     */
    LlmResponse invokeWithTools(List<ChatMessage> messages, List<ToolSpec> tools);

    /**
     * Chat call constrained to the given JSON schema, without tools.
     *
     * @throws LlmException when the provider call fails
     */
    StructuredResponse invokeStructured(List<ChatMessage> messages, Map<String, Object> jsonSchema);
}
