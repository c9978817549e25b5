package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * One declared state field: name, type string (e.g. {@code str}, {@code list[str]}), required flag and default.
 * {@code schema} only applies to {@code object} fields.
 */
public final class StateFieldConfig {

    private final String name;
    private final String type;
    private final boolean required;
    private final Object defaultValue;
    private final String description;
    private final Map<String, Object> schema;

    @JsonCreator
    public StateFieldConfig(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("required") Boolean required,
            @JsonProperty("default") Object defaultValue,
            @JsonProperty("description") String description,
            @JsonProperty("schema") Map<String, Object> schema) {
        this.name = name;
        this.type = type;
        this.required = Boolean.TRUE.equals(required);
        this.defaultValue = defaultValue;
        this.description = description;
        this.schema = schema != null ? Map.copyOf(schema) : Map.of();
    }

    /** Returns a copy carrying the given name (used when fields are declared as a name-keyed map). */
    public StateFieldConfig withName(String newName) {
        return new StateFieldConfig(newName, type, required, defaultValue, description, schema);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    @JsonProperty("default")
    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getSchema() {
        return schema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateFieldConfig that = (StateFieldConfig) o;
        return required == that.required
                && Objects.equals(name, that.name)
                && Objects.equals(type, that.type)
                && Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(description, that.description)
                && Objects.equals(schema, that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, required, defaultValue, description, schema);
    }
}
