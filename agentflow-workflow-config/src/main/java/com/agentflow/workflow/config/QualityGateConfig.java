package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Threshold on one aggregated run metric (e.g. {@code cost_usd}, {@code duration_ms}). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class QualityGateConfig {

    private final String metric;
    private final Double min;
    private final Double max;

    @JsonCreator
    public QualityGateConfig(
            @JsonProperty("metric") String metric,
            @JsonProperty("min") Double min,
            @JsonProperty("max") Double max) {
        this.metric = metric;
        this.min = min;
        this.max = max;
    }

    public String getMetric() {
        return metric;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }
}
