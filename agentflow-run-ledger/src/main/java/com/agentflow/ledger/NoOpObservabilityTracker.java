package com.agentflow.ledger;

/** Tracker that ignores every event. */
public final class NoOpObservabilityTracker implements ObservabilityTracker {

    public static final NoOpObservabilityTracker INSTANCE = new NoOpObservabilityTracker();

    @Override
    public void recordNodeStart(String runId, String nodeId) {
    }

    @Override
    public void recordNodeEnd(String runId, String nodeId, NodeMetrics metrics) {
    }

    @Override
    public void recordRunEnd(String runId, RunCompletion completion) {
    }
}
