package com.agentflow.engine.gates;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Outcome of checking one quality gate against the run metrics. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GateResult {

    private final String metric;
    private final boolean passed;
    private final Double actual;
    private final Double threshold;
    private final String message;

    public GateResult(String metric, boolean passed, Double actual, Double threshold, String message) {
        this.metric = metric;
        this.passed = passed;
        this.actual = actual;
        this.threshold = threshold;
        this.message = message;
    }

    public String getMetric() {
        return metric;
    }

    public boolean isPassed() {
        return passed;
    }

    /** Metric value; null when the metric was not found. */
    public Double getActual() {
        return actual;
    }

    public Double getThreshold() {
        return threshold;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return metric + ": " + message;
    }
}
