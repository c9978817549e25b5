package com.agentflow.tools.builtin;

import com.agentflow.tools.Tool;

import java.util.List;
import java.util.Map;

/**
 * Echoes its input as "ECHO: " + input. Accepts {@code input} or {@code text}.
 */
public final class EchoTool implements Tool {

    public static final String NAME = "echo";

    private static final String KEY_INPUT = "input";
    private static final String KEY_TEXT = "text";
    private static final String PREFIX = "ECHO: ";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Echoes the given text as 'ECHO: ' + input. Use for testing or simple passthrough.";
    }

    @Override
    public Map<String, Object> getParameters() {
        return Map.of(
                "type", "object",
                "properties", Map.of(KEY_INPUT, Map.of("type", "string", "description", "Text to echo")),
                "required", List.of(KEY_INPUT));
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        Object in = arguments.containsKey(KEY_INPUT) ? arguments.get(KEY_INPUT) : arguments.get(KEY_TEXT);
        String value = in != null ? in.toString().trim() : "";
        return PREFIX + value;
    }
}
