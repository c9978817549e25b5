package com.agentflow.ledger;

/** Lifecycle status of a run as recorded in the ledger and reported in outcomes. */
public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED;

    public String toValue() {
        return name().toLowerCase();
    }
}
