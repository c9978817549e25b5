package com.agentflow.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One message of a model conversation. Assistant messages may carry tool calls;
 * tool messages carry the name of the tool whose result they report.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ChatMessage {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private final String role;
    private final String content;
    private final List<ToolCall> toolCalls;
    private final String toolName;

    public ChatMessage(String role, String content, List<ToolCall> toolCalls, String toolName) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
        this.toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        this.toolName = toolName;
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(ROLE_SYSTEM, content, null, null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(ROLE_USER, content, null, null);
    }

    public static ChatMessage assistant(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(ROLE_ASSISTANT, content, toolCalls, null);
    }

    public static ChatMessage tool(String toolName, String content) {
        return new ChatMessage(ROLE_TOOL, content, null, toolName);
    }

    public String getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    @JsonProperty("tool_calls")
    public List<ToolCall> getToolCalls() {
        return toolCalls;
    }

    @JsonProperty("tool_name")
    public String getToolName() {
        return toolName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChatMessage that = (ChatMessage) o;
        return role.equals(that.role) && content.equals(that.content)
                && toolCalls.equals(that.toolCalls) && Objects.equals(toolName, that.toolName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content, toolCalls, toolName);
    }

    @Override
    public String toString() {
        return role + ": " + content;
    }
}
