package com.agentflow.llm.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/** Ollama /api/chat response (non-streaming). Ignores extra fields (created_at, done_reason, durations, ...). */
@JsonIgnoreProperties(ignoreUnknown = true)
final class OllamaChatResponse {

    private String model;
    private Message message;
    @JsonProperty("prompt_eval_count")
    private Long promptEvalCount;
    @JsonProperty("eval_count")
    private Long evalCount;

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Message {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ToolCall> toolCalls;

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
        public List<ToolCall> getToolCalls() { return toolCalls; }
        public void setToolCalls(List<ToolCall> toolCalls) { this.toolCalls = toolCalls; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ToolCall {
        private String id;
        private Function function;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public Function getFunction() { return function; }
        public void setFunction(Function function) { this.function = function; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Function {
        private String name;
        private Map<String, Object> arguments;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public Map<String, Object> getArguments() { return arguments; }
        public void setArguments(Map<String, Object> arguments) { this.arguments = arguments; }
    }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public Message getMessage() { return message; }
    public void setMessage(Message message) { this.message = message; }
    public Long getPromptEvalCount() { return promptEvalCount; }
    public void setPromptEvalCount(Long promptEvalCount) { this.promptEvalCount = promptEvalCount; }
    public Long getEvalCount() { return evalCount; }
    public void setEvalCount(Long evalCount) { this.evalCount = evalCount; }
}
