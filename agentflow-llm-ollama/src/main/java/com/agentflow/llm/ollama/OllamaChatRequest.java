package com.agentflow.llm.ollama;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/** Ollama /api/chat request body. {@code tools} and {@code format} are mutually exclusive in practice. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
final class OllamaChatRequest {

    private final String model;
    private final List<Message> messages;
    @JsonProperty("stream")
    private final boolean stream;
    private final List<Tool> tools;
    private final Object format;
    private final Map<String, Object> options;

    OllamaChatRequest(String model, List<Message> messages, List<Tool> tools, Object format, Map<String, Object> options) {
        this.model = model;
        this.messages = messages;
        this.stream = false;
        this.tools = tools;
        this.format = format;
        this.options = options;
    }

    public String getModel() { return model; }
    public List<Message> getMessages() { return messages; }
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public boolean isStream() { return stream; }
    public List<Tool> getTools() { return tools; }
    public Object getFormat() { return format; }
    public Map<String, Object> getOptions() { return options; }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    static final class Message {
        private final String role;
        private final String content;
        private final List<ToolCall> toolCalls;
        private final String toolName;

        Message(String role, String content, List<ToolCall> toolCalls, String toolName) {
            this.role = role;
            this.content = content;
            this.toolCalls = toolCalls;
            this.toolName = toolName;
        }

        public String getRole() { return role; }
        @JsonInclude(JsonInclude.Include.ALWAYS)
        public String getContent() { return content; }
        @JsonProperty("tool_calls")
        public List<ToolCall> getToolCalls() { return toolCalls; }
        @JsonProperty("tool_name")
        public String getToolName() { return toolName; }
    }

    static final class ToolCall {
        private final Function function;

        ToolCall(String name, Map<String, Object> arguments) {
            this.function = new Function(name, null, null, arguments);
        }

        public Function getFunction() { return function; }
    }

    static final class Tool {
        private final String type = "function";
        private final Function function;

        Tool(String name, String description, Map<String, Object> parameters) {
            this.function = new Function(name, description, parameters, null);
        }

        public String getType() { return type; }
        public Function getFunction() { return function; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class Function {
        private final String name;
        private final String description;
        private final Map<String, Object> parameters;
        private final Map<String, Object> arguments;

        Function(String name, String description, Map<String, Object> parameters, Map<String, Object> arguments) {
            this.name = name;
            this.description = description;
            this.parameters = parameters;
            this.arguments = arguments;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
        public Map<String, Object> getParameters() { return parameters; }
        public Map<String, Object> getArguments() { return arguments; }
    }
}
