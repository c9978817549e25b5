package com.agentflow.tools;

import java.util.Map;

/**
 * A named function the model may call during a node's tool-calling loop.
 * Implementations must be safe to call from several fork-join branches at once.
 */
public interface Tool {

    /** Name used in {@code nodes[].tools} and in model tool calls. */
    String getName();

    /** Human-readable description sent to the model. */
    String getDescription();

    /**
     * JSON schema of the arguments object (e.g. {@code {type: object, properties: {input: {type: string}}}}).
     * Default accepts an object with no declared properties.
     */
    default Map<String, Object> getParameters() {
        return Map.of("type", "object", "properties", Map.of());
    }

    /**
     * Runs the tool. The result is handed back to the model as an observation
     * (strings as-is, anything else serialized as JSON).
     */
    Object execute(Map<String, Object> arguments) throws Exception;
}
