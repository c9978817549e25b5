package com.agentflow.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** What is known about a run when it starts. */
public final class RunRecord {

    private final String workflowName;
    private final String workflowVersion;
    private final Map<String, Object> inputs;
    private final long startTimeMillis;

    public RunRecord(String workflowName, String workflowVersion, Map<String, Object> inputs, long startTimeMillis) {
        this.workflowName = Objects.requireNonNull(workflowName, "workflowName");
        this.workflowVersion = workflowVersion;
        this.inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
        this.startTimeMillis = startTimeMillis;
    }

    public String getWorkflowName() { return workflowName; }
    public String getWorkflowVersion() { return workflowVersion; }
    public Map<String, Object> getInputs() { return inputs; }
    public long getStartTimeMillis() { return startTimeMillis; }
}
