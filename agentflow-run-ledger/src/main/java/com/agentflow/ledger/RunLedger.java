package com.agentflow.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Fail-safe facade over the {@link RunRepository} and {@link ObservabilityTracker}.
 * Any exception from either is caught, logged, and not rethrown so a run never fails because of them.
 */
public final class RunLedger {

    private static final Logger log = LoggerFactory.getLogger(RunLedger.class);

    private final RunRepository repository;
    private final ObservabilityTracker tracker;

    public RunLedger(RunRepository repository, ObservabilityTracker tracker) {
        this.repository = repository != null ? repository : new NoOpRunRepository();
        this.tracker = tracker != null ? tracker : NoOpObservabilityTracker.INSTANCE;
    }

    /** Ledger that records nothing. */
    public static RunLedger disabled() {
        return new RunLedger(new NoOpRunRepository(), NoOpObservabilityTracker.INSTANCE);
    }

    /**
     * Creates the run record. When the repository fails (or returns no id) a local id is generated
     * so node events can still be correlated.
     */
    public String runStarted(RunRecord run) {
        try {
            String id = repository.create(run);
            if (id != null && !id.isBlank()) return id;
            log.warn("Run repository returned no id (workflow={}); using a local run id", run.getWorkflowName());
        } catch (Throwable t) {
            log.warn("Run repository create failed (workflow={}); execution continues. Error: {}", run.getWorkflowName(), t.getMessage(), t);
        }
        return "local-" + UUID.randomUUID();
    }

    public void runEnded(String runId, RunCompletion completion) {
        try {
            repository.update(runId, completion);
        } catch (Throwable t) {
            log.warn("Run repository update failed (runId={}); execution continues. Error: {}", runId, t.getMessage(), t);
        }
        try {
            tracker.recordRunEnd(runId, completion);
        } catch (Throwable t) {
            log.warn("Tracker recordRunEnd failed (runId={}); execution continues. Error: {}", runId, t.getMessage(), t);
        }
    }

    public void nodeStarted(String runId, String nodeId) {
        try {
            tracker.recordNodeStart(runId, nodeId);
        } catch (Throwable t) {
            log.warn("Tracker recordNodeStart failed (runId={}, nodeId={}); execution continues. Error: {}", runId, nodeId, t.getMessage(), t);
        }
    }

    public void nodeEnded(String runId, String nodeId, NodeMetrics metrics) {
        try {
            tracker.recordNodeEnd(runId, nodeId, metrics);
        } catch (Throwable t) {
            log.warn("Tracker recordNodeEnd failed (runId={}, nodeId={}); execution continues. Error: {}", runId, nodeId, t.getMessage(), t);
        }
    }

    public void nodeFailed(String runId, String nodeId, NodeMetrics metrics, String errorMessage) {
        try {
            tracker.recordNodeFailure(runId, nodeId, metrics, errorMessage);
        } catch (Throwable t) {
            log.warn("Tracker recordNodeFailure failed (runId={}, nodeId={}); execution continues. Error: {}", runId, nodeId, t.getMessage(), t);
        }
    }
}
