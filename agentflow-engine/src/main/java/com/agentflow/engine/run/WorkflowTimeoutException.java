package com.agentflow.engine.run;

import java.time.Duration;

/** Thrown when a run exceeds its overall execution timeout. In-flight branches are cancelled. */
public final class WorkflowTimeoutException extends RuntimeException {

    private final Duration timeout;

    public WorkflowTimeoutException(String workflowName, Duration timeout) {
        super("Workflow '" + workflowName + "' exceeded its timeout of " + timeout.getSeconds() + "s");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
