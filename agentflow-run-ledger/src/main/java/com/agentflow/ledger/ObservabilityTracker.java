package com.agentflow.ledger;

/**
 * Receives node and run events for metrics and tracing. Callers go through {@link RunLedger},
 * which absorbs every failure. Node events may arrive concurrently from fork-join branches.
 */
public interface ObservabilityTracker {

    void recordNodeStart(String runId, String nodeId);

    void recordNodeEnd(String runId, String nodeId, NodeMetrics metrics);

    /** Node ended with an error. Defaults to {@link #recordNodeEnd(String, String, NodeMetrics)}. */
    default void recordNodeFailure(String runId, String nodeId, NodeMetrics metrics, String errorMessage) {
        recordNodeEnd(runId, nodeId, metrics);
    }

    void recordRunEnd(String runId, RunCompletion completion);
}
