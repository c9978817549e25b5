package com.agentflow.ledger;

import java.math.BigDecimal;

/**
 * Per-node execution metrics: duration, token counts, estimated cost (USD), model, tool calls and
 * structured-output attempts.
 */
public final class NodeMetrics {

    private static final NodeMetrics NONE = new NodeMetrics(0, 0, 0, BigDecimal.ZERO, null, null, 0, 0);

    private final long durationMs;
    private final long promptTokens;
    private final long completionTokens;
    private final BigDecimal costUsd;
    private final String model;
    private final String provider;
    private final int toolCalls;
    private final int outputAttempts;

    public NodeMetrics(long durationMs, long promptTokens, long completionTokens, BigDecimal costUsd,
                       String model, String provider, int toolCalls, int outputAttempts) {
        this.durationMs = durationMs;
        this.promptTokens = promptTokens;
        this.completionTokens = completionTokens;
        this.costUsd = costUsd != null ? costUsd : BigDecimal.ZERO;
        this.model = model != null && !model.isBlank() ? model : null;
        this.provider = provider != null && !provider.isBlank() ? provider : null;
        this.toolCalls = toolCalls;
        this.outputAttempts = outputAttempts;
    }

    public static NodeMetrics none() {
        return NONE;
    }

    /** Same metrics with a different duration (the orchestrator measures wall time around the handler). */
    public NodeMetrics withDuration(long newDurationMs) {
        return new NodeMetrics(newDurationMs, promptTokens, completionTokens, costUsd, model, provider, toolCalls, outputAttempts);
    }

    public long getDurationMs() { return durationMs; }
    public long getPromptTokens() { return promptTokens; }
    public long getCompletionTokens() { return completionTokens; }
    public long getTotalTokens() { return promptTokens + completionTokens; }
    public BigDecimal getCostUsd() { return costUsd; }
    public String getModel() { return model; }
    public String getProvider() { return provider; }
    public int getToolCalls() { return toolCalls; }
    public int getOutputAttempts() { return outputAttempts; }

    @Override
    public String toString() {
        return "NodeMetrics{durationMs=" + durationMs + ", promptTokens=" + promptTokens
                + ", completionTokens=" + completionTokens + ", costUsd=" + costUsd.toPlainString()
                + ", model=" + model + ", toolCalls=" + toolCalls + ", outputAttempts=" + outputAttempts + "}";
    }
}
