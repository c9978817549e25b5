package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Bounded loop: re-enter the source node until {@code condition_field} is true or
 * {@code max_iterations} is reached, then continue at {@code exit_to} (default END).
 */
public final class LoopConfig {

    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final int MAX_ALLOWED_ITERATIONS = 100;

    private final int maxIterations;
    private final String conditionField;
    private final String exitTo;

    @JsonCreator
    public LoopConfig(
            @JsonProperty("max_iterations") Integer maxIterations,
            @JsonProperty("condition_field") String conditionField,
            @JsonProperty("exit_to") String exitTo) {
        this.maxIterations = maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
        this.conditionField = conditionField;
        this.exitTo = exitTo != null && !exitTo.isBlank() ? exitTo.trim() : EdgeConfig.END;
    }

    @JsonProperty("max_iterations")
    public int getMaxIterations() {
        return maxIterations;
    }

    @JsonProperty("condition_field")
    public String getConditionField() {
        return conditionField;
    }

    @JsonProperty("exit_to")
    public String getExitTo() {
        return exitTo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LoopConfig that = (LoopConfig) o;
        return maxIterations == that.maxIterations
                && Objects.equals(conditionField, that.conditionField)
                && Objects.equals(exitTo, that.exitTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxIterations, conditionField, exitTo);
    }
}
