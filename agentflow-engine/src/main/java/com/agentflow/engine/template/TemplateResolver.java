package com.agentflow.engine.template;

import com.agentflow.engine.state.ExecutionState;
import com.agentflow.workflow.validation.NearestMatch;
import com.agentflow.workflow.validation.Placeholders;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Resolves {@code {name}}, {@code {state.name}} and {@code {name.key}} placeholders against node inputs
 * and a state snapshot. Node inputs take precedence over state fields; the {@code state.} prefix always
 * reads state. Strings render as-is, lists and maps as JSON, null as an empty string.
 * Pure: no I/O and no shared mutable state.
 */
public final class TemplateResolver {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public String resolve(String template, Map<String, Object> inputs, ExecutionState state) {
        if (template == null || template.isEmpty()) return "";
        Map<String, Object> in = inputs != null ? inputs : Map.of();
        Matcher m = Placeholders.PATTERN.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            Object value = lookup(m.group(1), in, state);
            m.appendReplacement(out, Matcher.quoteReplacement(render(value)));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Resolves a node's {@code inputs} mappings against state. A mapping that is exactly one placeholder
     * keeps the raw value (lists stay lists); anything else is rendered as text.
     */
    public Map<String, Object> resolveInputs(Map<String, String> mappings, ExecutionState state) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (mappings == null) return resolved;
        for (Map.Entry<String, String> e : mappings.entrySet()) {
            String template = e.getValue() != null ? e.getValue().trim() : "";
            Matcher single = Placeholders.PATTERN.matcher(template);
            if (single.matches()) {
                resolved.put(e.getKey(), lookup(single.group(1), Map.of(), state));
            } else {
                resolved.put(e.getKey(), resolve(template, Map.of(), state));
            }
        }
        return resolved;
    }

    private Object lookup(String expression, Map<String, Object> inputs, ExecutionState state) {
        if (!Placeholders.hasStatePrefix(expression) && inputs.containsKey(expression)) {
            return inputs.get(expression);
        }
        String path = Placeholders.stripStatePrefix(expression);
        String[] parts = path.split("\\.");
        Object current;
        if (!Placeholders.hasStatePrefix(expression) && inputs.containsKey(parts[0])) {
            current = inputs.get(parts[0]);
        } else if (state != null && state.getType().hasField(parts[0])) {
            current = state.get(parts[0]);
        } else {
            throw unresolved(expression, inputs, state);
        }
        for (int i = 1; i < parts.length; i++) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(parts[i])) {
                throw new TemplateException("Variable '" + expression + "' cannot be resolved: no key '" + parts[i]
                        + "' at '" + String.join(".", Arrays.copyOfRange(parts, 0, i + 1)) + "'",
                        expression, null);
            }
            current = map.get(parts[i]);
        }
        return current;
    }

    private static TemplateException unresolved(String expression, Map<String, Object> inputs, ExecutionState state) {
        List<String> candidates = new ArrayList<>(inputs.keySet());
        List<String> stateFields = state != null ? state.getType().fieldNames() : List.of();
        candidates.addAll(stateFields);
        String root = Placeholders.rootName(expression);
        String suggestion = NearestMatch.find(root, candidates).orElse(null);
        StringBuilder message = new StringBuilder("Variable '").append(expression).append("' not found in inputs or state");
        if (suggestion != null) message.append(". Did you mean '").append(suggestion).append("'?");
        message.append(" Available inputs: ").append(inputs.keySet());
        message.append(". Available state fields: ").append(stateFields);
        return new TemplateException(message.toString(), expression, suggestion);
    }

    static String render(Object value) {
        if (value == null) return "";
        if (value instanceof String s) return s;
        if (value instanceof Map || value instanceof List) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
        return value.toString();
    }
}
