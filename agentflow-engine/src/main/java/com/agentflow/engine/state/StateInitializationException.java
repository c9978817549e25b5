package com.agentflow.engine.state;

/**
 * Thrown when the run state cannot be created from the caller's inputs (unknown or missing required
 * field, wrong value type) or when a delta does not fit the field table.
 */
public final class StateInitializationException extends RuntimeException {

    private final String fieldName;

    public StateInitializationException(String fieldName, String message) {
        super(message);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
