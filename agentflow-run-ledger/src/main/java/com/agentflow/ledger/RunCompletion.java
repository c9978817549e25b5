package com.agentflow.ledger;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Final facts about a run, written to the repository and reported to the tracker once the run ends.
 * {@code errorKind} and {@code errorMessage} are null for successful runs.
 */
public final class RunCompletion {

    private final RunStatus status;
    private final long endTimeMillis;
    private final long durationMs;
    private final long totalPromptTokens;
    private final long totalCompletionTokens;
    private final BigDecimal totalCostUsd;
    private final int nodeCount;
    private final Map<String, Object> finalState;
    private final String errorKind;
    private final String errorMessage;
    private final boolean deployBlocked;

    public RunCompletion(RunStatus status, long endTimeMillis, long durationMs, long totalPromptTokens,
                         long totalCompletionTokens, BigDecimal totalCostUsd, int nodeCount,
                         Map<String, Object> finalState, String errorKind, String errorMessage, boolean deployBlocked) {
        this.status = Objects.requireNonNull(status, "status");
        this.endTimeMillis = endTimeMillis;
        this.durationMs = durationMs;
        this.totalPromptTokens = totalPromptTokens;
        this.totalCompletionTokens = totalCompletionTokens;
        this.totalCostUsd = totalCostUsd != null ? totalCostUsd : BigDecimal.ZERO;
        this.nodeCount = nodeCount;
        this.finalState = finalState != null ? Collections.unmodifiableMap(new LinkedHashMap<>(finalState)) : Map.of();
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.deployBlocked = deployBlocked;
    }

    public RunStatus getStatus() { return status; }
    public long getEndTimeMillis() { return endTimeMillis; }
    public long getDurationMs() { return durationMs; }
    public long getTotalPromptTokens() { return totalPromptTokens; }
    public long getTotalCompletionTokens() { return totalCompletionTokens; }
    public BigDecimal getTotalCostUsd() { return totalCostUsd; }
    public int getNodeCount() { return nodeCount; }
    public Map<String, Object> getFinalState() { return finalState; }
    public String getErrorKind() { return errorKind; }
    public String getErrorMessage() { return errorMessage; }
    public boolean isDeployBlocked() { return deployBlocked; }
}
