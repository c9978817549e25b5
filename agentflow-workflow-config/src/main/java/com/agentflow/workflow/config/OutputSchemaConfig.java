package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Declared output contract of a node. {@code type: object} lists one field per node output;
 * any other type describes a single value written to the node's only output.
 */
public final class OutputSchemaConfig {

    public static final String OBJECT_TYPE = "object";

    private final String type;
    private final List<OutputFieldConfig> fields;
    private final String description;

    @JsonCreator
    public OutputSchemaConfig(
            @JsonProperty("type") String type,
            @JsonProperty("fields") List<OutputFieldConfig> fields,
            @JsonProperty("description") String description) {
        this.type = type;
        this.fields = fields != null ? List.copyOf(fields) : List.of();
        this.description = description;
    }

    public String getType() {
        return type;
    }

    public List<OutputFieldConfig> getFields() {
        return fields;
    }

    public String getDescription() {
        return description;
    }

    @JsonIgnore
    public boolean isObject() {
        return OBJECT_TYPE.equals(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutputSchemaConfig that = (OutputSchemaConfig) o;
        return Objects.equals(type, that.type) && Objects.equals(fields, that.fields)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, fields, description);
    }
}
