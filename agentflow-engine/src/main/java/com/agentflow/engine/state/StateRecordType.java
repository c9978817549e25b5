package com.agentflow.engine.state;

import com.agentflow.workflow.validation.NearestMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime record type of one workflow: an ordered field table with a merge policy per field.
 * Creates the initial {@link ExecutionState} and merges node deltas into it. Immutable; shared by
 * every branch of a run.
 */
public final class StateRecordType {

    private final List<FieldSpec> fields;
    private final Map<String, FieldSpec> byName;

    StateRecordType(List<FieldSpec> fields) {
        this.fields = List.copyOf(fields);
        Map<String, FieldSpec> map = new LinkedHashMap<>();
        for (FieldSpec f : fields) {
            map.put(f.getName(), f);
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    public List<FieldSpec> getFields() {
        return fields;
    }

    public List<String> fieldNames() {
        return new ArrayList<>(byName.keySet());
    }

    public Optional<FieldSpec> findField(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean hasField(String name) {
        return byName.containsKey(name);
    }

    /** Field spec by name; unknown names are a programming error in callers. */
    public FieldSpec field(String name) {
        FieldSpec spec = byName.get(name);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown state field: " + name);
        }
        return spec;
    }

    /**
     * Initial state from caller inputs and declared defaults.
     *
     * @throws StateInitializationException for an unknown input, a missing required input or a value of the wrong type
     */
    public ExecutionState initialize(Map<String, ?> inputs) {
        Map<String, ?> in = inputs != null ? inputs : Map.of();
        for (String key : in.keySet()) {
            if (!byName.containsKey(key)) {
                String hint = NearestMatch.suggestion(key, byName.keySet(), "Valid fields");
                throw new StateInitializationException(key, "Unknown input '" + key + "'. " + hint);
            }
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldSpec f : fields) {
            Object value;
            if (in.containsKey(f.getName()) && in.get(f.getName()) != null) {
                value = checked(f, in.get(f.getName()), "input");
            } else if (f.isRequired()) {
                throw new StateInitializationException(f.getName(), "Missing required input '" + f.getName() + "'");
            } else {
                value = f.getDefaultValue();
            }
            values.put(f.getName(), value);
        }
        return new ExecutionState(this, values);
    }

    /**
     * Returns {@code base} with {@code delta} applied field by field using each field's merge policy.
     *
     * @throws StateInitializationException when the delta names an unknown field or carries a wrongly typed value
     */
    public ExecutionState merge(ExecutionState base, Map<String, ?> delta) {
        if (delta == null || delta.isEmpty()) return base;
        Map<String, Object> values = new LinkedHashMap<>(base.asMap());
        for (Map.Entry<String, ?> e : delta.entrySet()) {
            FieldSpec f = byName.get(e.getKey());
            if (f == null) {
                throw new StateInitializationException(e.getKey(), "Delta writes unknown state field '" + e.getKey() + "'");
            }
            Object value = e.getValue() != null ? checked(f, e.getValue(), "delta") : null;
            values.put(f.getName(), f.getMergePolicy().merge(values.get(f.getName()), value));
        }
        return new ExecutionState(this, values);
    }

    /** Applies deltas in list order; the join barrier passes them in branch declaration order. */
    public ExecutionState mergeAll(ExecutionState base, List<? extends Map<String, ?>> deltas) {
        ExecutionState state = base;
        for (Map<String, ?> delta : deltas) {
            state = merge(state, delta);
        }
        return state;
    }

    private static Object checked(FieldSpec f, Object value, String what) {
        if (!f.getType().accepts(value)) {
            throw new StateInitializationException(f.getName(), "State field '" + f.getName() + "' expects "
                    + f.getType() + " but " + what + " value is " + value.getClass().getSimpleName() + " (" + value + ")");
        }
        return f.getType().normalize(value);
    }

    @Override
    public String toString() {
        return "StateRecordType" + fields;
    }
}
