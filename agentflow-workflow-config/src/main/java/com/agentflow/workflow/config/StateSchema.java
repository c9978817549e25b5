package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of declared state fields. The document may declare {@code fields} either as a list of
 * {@code {name, type, ...}} entries or as a map keyed by field name; declaration order is kept in both cases.
 */
public final class StateSchema {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<StateFieldConfig> fields;

    public StateSchema(List<StateFieldConfig> fields) {
        this.fields = fields != null ? List.copyOf(fields) : List.of();
    }

    @JsonCreator
    public static StateSchema fromJson(@JsonProperty("fields") JsonNode fields) {
        return new StateSchema(readFields(fields));
    }

    private static List<StateFieldConfig> readFields(JsonNode node) {
        List<StateFieldConfig> out = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return out;
        }
        try {
            if (node.isArray()) {
                for (JsonNode entry : node) {
                    out.add(MAPPER.treeToValue(entry, StateFieldConfig.class));
                }
            } else if (node.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    StateFieldConfig field = e.getValue().isTextual()
                            ? new StateFieldConfig(e.getKey(), e.getValue().asText(), false, null, null, null)
                            : MAPPER.treeToValue(e.getValue(), StateFieldConfig.class).withName(e.getKey());
                    out.add(field);
                }
            }
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException("Invalid state field declaration: " + e.getOriginalMessage(), e));
        }
        return out;
    }

    public List<StateFieldConfig> getFields() {
        return fields;
    }

    public Optional<StateFieldConfig> findField(String name) {
        if (name == null) return Optional.empty();
        for (StateFieldConfig f : fields) {
            if (name.equals(f.getName())) return Optional.of(f);
        }
        return Optional.empty();
    }

    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (StateFieldConfig f : fields) {
            names.add(f.getName());
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(fields, ((StateSchema) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }
}
