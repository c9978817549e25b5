package com.agentflow.engine.output;

import com.agentflow.workflow.type.FieldType;

import java.util.Objects;

/** One field the model must return: schema name, state field it writes, type and description. */
public final class OutputField {

    private final String name;
    private final String stateField;
    private final FieldType type;
    private final String description;

    public OutputField(String name, String stateField, FieldType type, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.stateField = Objects.requireNonNull(stateField, "stateField");
        this.type = Objects.requireNonNull(type, "type");
        this.description = description;
    }

    public String getName() { return name; }
    public String getStateField() { return stateField; }
    public FieldType getType() { return type; }
    public String getDescription() { return description; }
}
