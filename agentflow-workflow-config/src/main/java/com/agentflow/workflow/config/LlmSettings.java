package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * LLM settings at workflow level ({@code config.llm}) or node level ({@code nodes[].llm}).
 * All fields are optional; {@link #overriddenBy(LlmSettings)} merges field by field.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LlmSettings {

    public static final List<String> SUPPORTED_PROVIDERS = List.of("openai", "anthropic", "google", "ollama");

    private final String provider;
    private final String model;
    private final Double temperature;
    private final Integer maxTokens;
    private final String apiBase;

    @JsonCreator
    public LlmSettings(
            @JsonProperty("provider") String provider,
            @JsonProperty("model") String model,
            @JsonProperty("temperature") Double temperature,
            @JsonProperty("max_tokens") Integer maxTokens,
            @JsonProperty("api_base") String apiBase) {
        this.provider = provider;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.apiBase = apiBase;
    }

    public static LlmSettings empty() {
        return new LlmSettings(null, null, null, null, null);
    }

    /** Returns settings where every non-null field of {@code override} replaces the value here. */
    public LlmSettings overriddenBy(LlmSettings override) {
        if (override == null) return this;
        return new LlmSettings(
                override.provider != null ? override.provider : provider,
                override.model != null ? override.model : model,
                override.temperature != null ? override.temperature : temperature,
                override.maxTokens != null ? override.maxTokens : maxTokens,
                override.apiBase != null ? override.apiBase : apiBase);
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public Double getTemperature() {
        return temperature;
    }

    @JsonProperty("max_tokens")
    public Integer getMaxTokens() {
        return maxTokens;
    }

    @JsonProperty("api_base")
    public String getApiBase() {
        return apiBase;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LlmSettings that = (LlmSettings) o;
        return Objects.equals(provider, that.provider) && Objects.equals(model, that.model)
                && Objects.equals(temperature, that.temperature) && Objects.equals(maxTokens, that.maxTokens)
                && Objects.equals(apiBase, that.apiBase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, model, temperature, maxTokens, apiBase);
    }

    @Override
    public String toString() {
        return "LlmSettings{provider=" + provider + ", model=" + model + ", temperature=" + temperature
                + ", maxTokens=" + maxTokens + ", apiBase=" + apiBase + "}";
    }
}
