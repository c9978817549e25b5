package com.agentflow.llm;

import java.util.Map;
import java.util.Objects;

/** Tool description bound to a model call: name, description and JSON schema of its arguments. */
public final class ToolSpec {

    private final String name;
    private final String description;
    private final Map<String, Object> parameters;

    public ToolSpec(String name, String description, Map<String, Object> parameters) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description != null ? description : "";
        this.parameters = parameters != null ? Map.copyOf(parameters) : Map.of("type", "object");
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }
}
