package com.agentflow.workflow.validation;

import java.util.List;

/**
 * Thrown when a workflow document fails validation. Raised before any model call is made.
 */
public final class ConfigValidationException extends RuntimeException {

    private final ValidationResult validationResult;

    public ConfigValidationException(ValidationResult validationResult) {
        super(validationResult != null && !validationResult.getErrors().isEmpty()
                ? "Config validation failed: " + String.join("; ", validationResult.getErrors())
                : "Config validation failed");
        this.validationResult = validationResult;
    }

    public ConfigValidationException(Violation violation) {
        this(ValidationResult.failure(violation));
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    public List<Violation> getViolations() {
        return validationResult != null ? validationResult.getViolations() : List.of();
    }
}
