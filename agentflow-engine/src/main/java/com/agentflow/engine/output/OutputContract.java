package com.agentflow.engine.output;

import com.agentflow.workflow.type.FieldKind;
import com.agentflow.workflow.type.FieldType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed result contract of one node. Object schemas list their fields; simple schemas wrap a single
 * value in a {@code result} field that is written to the node's only output.
 * <p>
 * Validation is lenient the way model output needs: whole numbers are accepted for int, numeric strings
 * for int and float, and "true"/"false" for bool. Fields the contract does not name are ignored.
 */
public final class OutputContract {

    public static final String RESULT_FIELD = "result";

    private final String nodeId;
    private final boolean object;
    private final List<OutputField> fields;
    private final String description;

    public OutputContract(String nodeId, boolean object, List<OutputField> fields, String description) {
        this.nodeId = nodeId;
        this.object = object;
        this.fields = List.copyOf(fields);
        this.description = description;
    }

    public String getNodeId() {
        return nodeId;
    }

    public boolean isObject() {
        return object;
    }

    public List<OutputField> getFields() {
        return fields;
    }

    public OutputCheck validate(Map<String, Object> raw) {
        if (raw == null) {
            return OutputCheck.invalid(List.of("response is not a JSON object"));
        }
        List<String> problems = new ArrayList<>();
        Map<String, Object> delta = new LinkedHashMap<>();
        for (OutputField f : fields) {
            if (!raw.containsKey(f.getName()) || raw.get(f.getName()) == null) {
                problems.add("missing field '" + f.getName() + "' (" + f.getType() + ")");
                continue;
            }
            Object value = coerce(f.getType(), raw.get(f.getName()));
            if (value == null) {
                Object actual = raw.get(f.getName());
                problems.add("field '" + f.getName() + "' must be " + f.getType() + ", got "
                        + actual.getClass().getSimpleName() + " " + abbreviate(actual));
                continue;
            }
            delta.put(f.getStateField(), value);
        }
        return problems.isEmpty() ? OutputCheck.valid(delta) : OutputCheck.invalid(problems);
    }

    /** JSON schema passed to the model for structured output. */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (OutputField f : fields) {
            Map<String, Object> prop = jsonType(f.getType());
            if (f.getDescription() != null && !f.getDescription().isBlank()) {
                prop.put("description", f.getDescription());
            }
            properties.put(f.getName(), prop);
            required.add(f.getName());
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        if (description != null && !description.isBlank()) schema.put("description", description);
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    private static Map<String, Object> jsonType(FieldType type) {
        Map<String, Object> out = new LinkedHashMap<>();
        switch (type.getKind()) {
            case STRING -> out.put("type", "string");
            case INTEGER -> out.put("type", "integer");
            case FLOAT -> out.put("type", "number");
            case BOOLEAN -> out.put("type", "boolean");
            case LIST -> {
                out.put("type", "array");
                if (type.getElementType() != null) out.put("items", jsonType(type.getElementType()));
            }
            default -> out.put("type", "object");
        }
        return out;
    }

    /** Returns the normalized value, or null when the value cannot be read as {@code type}. */
    private static Object coerce(FieldType type, Object value) {
        if (type.accepts(value)) return type.normalize(value);
        if (value instanceof String s) {
            String t = s.trim();
            try {
                if (type.getKind() == FieldKind.INTEGER) return Long.parseLong(t);
                if (type.getKind() == FieldKind.FLOAT) return Double.parseDouble(t);
            } catch (NumberFormatException e) {
                return null;
            }
            if (type.getKind() == FieldKind.BOOLEAN) {
                String lower = t.toLowerCase(Locale.ROOT);
                if (lower.equals("true")) return Boolean.TRUE;
                if (lower.equals("false")) return Boolean.FALSE;
            }
        }
        if (type.isList() && value instanceof List<?> list && type.getElementType() != null) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                Object c = item != null ? coerce(type.getElementType(), item) : null;
                if (c == null) return null;
                out.add(c);
            }
            return out;
        }
        return null;
    }

    private static String abbreviate(Object value) {
        String s = String.valueOf(value);
        return s.length() > 60 ? s.substring(0, 57) + "..." : s;
    }
}
