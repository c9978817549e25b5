package com.agentflow.engine.run;

import com.agentflow.engine.gates.GateReport;
import com.agentflow.ledger.RunStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one run, created once by {@link RunOrchestrator} and never mutated.
 * On failure {@code state} is the last merged state (partial) and {@code error} says what went wrong.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"run_id", "workflow", "status", "error", "state", "metrics", "gates", "deploy_blocked", "node_errors"})
public final class RunOutcome {

    private final String runId;
    private final String workflowName;
    private final RunStatus status;
    private final Map<String, Object> state;
    private final RunMetrics metrics;
    private final RunError error;
    private final GateReport gates;
    private final boolean deployBlocked;
    private final List<RunError> nodeErrors;

    private RunOutcome(String runId, String workflowName, RunStatus status, Map<String, Object> state,
                       RunMetrics metrics, RunError error, GateReport gates, boolean deployBlocked,
                       List<RunError> nodeErrors) {
        this.runId = runId;
        this.workflowName = workflowName;
        this.status = Objects.requireNonNull(status, "status");
        this.state = state != null ? Collections.unmodifiableMap(new LinkedHashMap<>(state)) : Map.of();
        this.metrics = metrics != null ? metrics : RunMetrics.empty(0);
        this.error = error;
        this.gates = gates;
        this.deployBlocked = deployBlocked;
        this.nodeErrors = nodeErrors != null ? List.copyOf(nodeErrors) : List.of();
    }

    public static RunOutcome succeeded(String runId, String workflowName, Map<String, Object> state, RunMetrics metrics,
                                       GateReport gates, boolean deployBlocked, List<RunError> nodeErrors) {
        return new RunOutcome(runId, workflowName, RunStatus.SUCCEEDED, state, metrics, null, gates, deployBlocked, nodeErrors);
    }

    public static RunOutcome failed(String runId, String workflowName, Map<String, Object> partialState,
                                    RunMetrics metrics, RunError error, GateReport gates, List<RunError> nodeErrors) {
        return new RunOutcome(runId, workflowName, RunStatus.FAILED, partialState, metrics,
                Objects.requireNonNull(error, "error"), gates, false, nodeErrors);
    }

    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("workflow")
    public String getWorkflowName() {
        return workflowName;
    }

    @JsonIgnore
    public RunStatus getStatus() {
        return status;
    }

    @JsonProperty("status")
    public String getStatusValue() {
        return status.toValue();
    }

    @JsonIgnore
    public boolean isSucceeded() {
        return status == RunStatus.SUCCEEDED;
    }

    /** Final state on success; last merged state on failure. May contain null values for unset fields. */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Map<String, Object> getState() {
        return state;
    }

    public RunMetrics getMetrics() {
        return metrics;
    }

    public RunError getError() {
        return error;
    }

    public GateReport getGates() {
        return gates;
    }

    @JsonProperty("deploy_blocked")
    public boolean isDeployBlocked() {
        return deployBlocked;
    }

    /** Failures of nodes with {@code break_on_error: false}; the run continued past them. */
    @JsonProperty("node_errors")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<RunError> getNodeErrors() {
        return nodeErrors;
    }

    @Override
    public String toString() {
        return "RunOutcome{runId=" + runId + ", workflow=" + workflowName + ", status=" + status.toValue()
                + (error != null ? ", error=" + error : "") + "}";
    }
}
