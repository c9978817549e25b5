package com.agentflow.engine.gates;

import java.util.List;

/** Thrown when gates fail and the workflow's {@code on_fail} action is {@code fail}. */
public final class QualityGateException extends RuntimeException {

    private final List<GateResult> failedGates;

    public QualityGateException(String workflowName, List<GateResult> failedGates) {
        super("Quality gates failed for " + workflowName + ": " + failedGates.size() + " gate(s) failed " + failedGates);
        this.failedGates = List.copyOf(failedGates);
    }

    public List<GateResult> getFailedGates() {
        return failedGates;
    }
}
