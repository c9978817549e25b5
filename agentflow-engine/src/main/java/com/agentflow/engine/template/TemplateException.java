package com.agentflow.engine.template;

/**
 * Thrown when a template placeholder names neither a node input nor a state field.
 */
public final class TemplateException extends RuntimeException {

    private final String variable;
    private final String suggestion;

    public TemplateException(String message, String variable, String suggestion) {
        super(message);
        this.variable = variable;
        this.suggestion = suggestion;
    }

    public String getVariable() {
        return variable;
    }

    /** Closest known name when the placeholder looks like a typo; null otherwise. */
    public String getSuggestion() {
        return suggestion;
    }
}
