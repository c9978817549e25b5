package com.agentflow.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable name to tool map, built once at process start and shared by every run.
 */
public final class ToolRegistry {

    private static final ToolRegistry EMPTY = new ToolRegistry(Map.of());

    private final Map<String, Tool> tools;

    private ToolRegistry(Map<String, Tool> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static ToolRegistry empty() {
        return EMPTY;
    }

    public static ToolRegistry of(Tool... tools) {
        Builder b = builder();
        for (Tool t : tools) {
            b.register(t);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(name != null ? tools.get(name) : null);
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /** Registered names in registration order. */
    public Set<String> names() {
        return tools.keySet();
    }

    /**
     * Tools for the given names, in the given order.
     *
     * @throws ToolExecutionException when a name is not registered
     */
    public List<Tool> resolve(List<String> names) {
        List<Tool> out = new ArrayList<>(names.size());
        for (String name : names) {
            Tool t = tools.get(name);
            if (t == null) {
                throw new ToolExecutionException(name, "Unknown tool: " + name + ". Registered: " + tools.keySet());
            }
            out.add(t);
        }
        return out;
    }

    public int size() {
        return tools.size();
    }

    public static final class Builder {
        private final Map<String, Tool> tools = new LinkedHashMap<>();

        public Builder register(Tool tool) {
            if (tool == null || tool.getName() == null || tool.getName().isBlank()) {
                throw new IllegalArgumentException("Tool and tool name are required");
            }
            if (tools.putIfAbsent(tool.getName(), tool) != null) {
                throw new IllegalArgumentException("Tool already registered: " + tool.getName());
            }
            return this;
        }

        public ToolRegistry build() {
            return new ToolRegistry(tools);
        }
    }
}
