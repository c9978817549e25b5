package com.agentflow.workflow.load;

/** Thrown when a workflow document cannot be read or parsed. */
public final class WorkflowConfigLoadException extends RuntimeException {

    private final String source;

    public WorkflowConfigLoadException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
