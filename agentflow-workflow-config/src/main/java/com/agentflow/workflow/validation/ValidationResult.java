package com.agentflow.workflow.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of validating a workflow document. Carries every violation found in the phase that failed.
 */
public final class ValidationResult {

    private final boolean valid;
    private final List<Violation> violations;

    private ValidationResult(boolean valid, List<Violation> violations) {
        this.valid = valid;
        this.violations = violations != null ? Collections.unmodifiableList(new ArrayList<>(violations)) : List.of();
    }

    public static ValidationResult success() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult failure(List<Violation> violations) {
        return new ValidationResult(false, violations != null ? violations : List.of());
    }

    public static ValidationResult failure(Violation single) {
        return new ValidationResult(false, List.of(Objects.requireNonNull(single, "single")));
    }

    public boolean isValid() {
        return valid;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    /** Violations rendered as {@code path: message (suggestion)} strings. */
    public List<String> getErrors() {
        List<String> out = new ArrayList<>(violations.size());
        for (Violation v : violations) {
            out.add(v.toString());
        }
        return out;
    }
}
