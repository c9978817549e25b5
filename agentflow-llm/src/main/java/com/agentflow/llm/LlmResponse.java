package com.agentflow.llm;

import java.util.List;

/** Response of a tool-enabled call: text content and any tool calls the model requested. */
public final class LlmResponse {

    private final String content;
    private final List<ToolCall> toolCalls;
    private final TokenUsage usage;
    private final String model;

    public LlmResponse(String content, List<ToolCall> toolCalls, TokenUsage usage, String model) {
        this.content = content != null ? content : "";
        this.toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        this.usage = usage != null ? usage : TokenUsage.zero();
        this.model = model;
    }

    public static LlmResponse text(String content) {
        return new LlmResponse(content, List.of(), TokenUsage.zero(), null);
    }

    public String getContent() {
        return content;
    }

    public List<ToolCall> getToolCalls() {
        return toolCalls;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public TokenUsage getUsage() {
        return usage;
    }

    public String getModel() {
        return model;
    }
}
