package com.agentflow.engine.state;

import com.agentflow.workflow.type.FieldType;

import java.util.Objects;

/**
 * One entry of the field table: position, name, parsed type, merge policy and initial value rules.
 */
public final class FieldSpec {

    private final int index;
    private final String name;
    private final FieldType type;
    private final MergePolicy mergePolicy;
    private final boolean required;
    private final Object defaultValue;
    private final String description;

    public FieldSpec(int index, String name, FieldType type, MergePolicy mergePolicy,
                     boolean required, Object defaultValue, String description) {
        this.index = index;
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.mergePolicy = Objects.requireNonNull(mergePolicy, "mergePolicy");
        this.required = required;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public MergePolicy getMergePolicy() {
        return mergePolicy;
    }

    public boolean isRequired() {
        return required;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return name + ":" + type + "(" + mergePolicy + ")";
    }
}
