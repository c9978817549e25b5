package com.agentflow.workflow;

import com.agentflow.workflow.config.WorkflowConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of workflow documents. JSON and YAML share the same model;
 * unknown keys are ignored and nulls are excluded when serializing.
 */
public final class WorkflowConfigs {

    private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
    private static final ObjectMapper YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));

    private WorkflowConfigs() {
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Deserializes a workflow document from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static WorkflowConfig fromJson(String json) {
        try {
            return JSON_MAPPER.readValue(json, WorkflowConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Deserializes a workflow document from a YAML string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static WorkflowConfig fromYaml(String yaml) {
        try {
            return YAML_MAPPER.readValue(yaml, WorkflowConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(WorkflowConfig config) {
        try {
            return JSON_MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(WorkflowConfig config) {
        try {
            return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Shared JSON mapper for callers that serialize state snapshots and outcomes alongside configs. */
    public static ObjectMapper jsonMapper() {
        return JSON_MAPPER;
    }
}
