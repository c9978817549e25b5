package com.agentflow.llm;

import java.util.Objects;

/**
 * Resolved model settings for one node: provider, model, sampling and optional endpoint override.
 * Null {@code temperature} and {@code maxTokens} leave the provider defaults in place.
 */
public final class LlmOptions {

    private final String provider;
    private final String model;
    private final Double temperature;
    private final Integer maxTokens;
    private final String apiBase;

    public LlmOptions(String provider, String model, Double temperature, Integer maxTokens, String apiBase) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.model = Objects.requireNonNull(model, "model");
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.apiBase = apiBase;
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

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public String getApiBase() {
        return apiBase;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LlmOptions that = (LlmOptions) o;
        return provider.equals(that.provider) && model.equals(that.model)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(maxTokens, that.maxTokens)
                && Objects.equals(apiBase, that.apiBase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, model, temperature, maxTokens, apiBase);
    }

    @Override
    public String toString() {
        return provider + "/" + model;
    }
}
