package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happens when a quality gate fails after a run reaches END.
 * Unknown values deserialize as {@link #UNKNOWN} and are reported by the validator.
 */
public enum GateAction {
    /** Log the failed gates; the run still completes. */
    WARN,
    /** Convert the run to failed. */
    FAIL,
    /** Run completes but a deploy-block flag is set for the workflow. */
    BLOCK_DEPLOY,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static GateAction fromValue(String value) {
        if (value == null || value.isBlank()) return WARN;
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (GateAction a : values()) {
            if (a != UNKNOWN && a.name().equals(normalized)) return a;
        }
        return UNKNOWN;
    }
}
