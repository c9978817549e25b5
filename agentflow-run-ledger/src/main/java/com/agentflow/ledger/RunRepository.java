package com.agentflow.ledger;

/**
 * Persistent store of run history. Callers go through {@link RunLedger}, which absorbs every failure.
 */
public interface RunRepository {

    /** Creates the run record and returns its id. */
    String create(RunRecord run);

    void update(String runId, RunCompletion completion);
}
