package com.agentflow.engine.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a run's state. Nodes read a snapshot and return a delta;
 * {@link StateRecordType#merge} produces the next snapshot. Accessors reject names outside the field table.
 */
public final class ExecutionState {

    private final StateRecordType type;
    private final Map<String, Object> values;

    ExecutionState(StateRecordType type, Map<String, Object> values) {
        this.type = type;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public StateRecordType getType() {
        return type;
    }

    public Object get(String field) {
        type.field(field);
        return values.get(field);
    }

    public boolean isSet(String field) {
        return get(field) != null;
    }

    public String getString(String field) {
        Object v = get(field);
        return v != null ? v.toString() : null;
    }

    public Long getLong(String field) {
        Object v = get(field);
        return v instanceof Number n ? n.longValue() : null;
    }

    public Double getDouble(String field) {
        Object v = get(field);
        return v instanceof Number n ? n.doubleValue() : null;
    }

    public boolean getBoolean(String field) {
        return Boolean.TRUE.equals(get(field));
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String field) {
        Object v = get(field);
        return v instanceof List<?> ? (List<Object>) v : List.of();
    }

    /** Field values in declaration order; unset fields map to null. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
