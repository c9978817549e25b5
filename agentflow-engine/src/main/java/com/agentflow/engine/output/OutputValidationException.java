package com.agentflow.engine.output;

import com.agentflow.ledger.NodeMetrics;

import java.util.List;

/**
 * Thrown when a node's structured output still fails its contract after every retry. Carries the
 * metrics (tokens, cost, attempts) spent on the node before it gave up.
 */
public final class OutputValidationException extends RuntimeException {

    private final String nodeId;
    private final int attempts;
    private final List<String> problems;
    private final NodeMetrics metrics;

    public OutputValidationException(String nodeId, int attempts, List<String> problems) {
        this(nodeId, attempts, problems, NodeMetrics.none());
    }

    public OutputValidationException(String nodeId, int attempts, List<String> problems, NodeMetrics metrics) {
        super("Node '" + nodeId + "': structured output failed validation after " + attempts
                + " attempt(s): " + String.join("; ", problems));
        this.nodeId = nodeId;
        this.attempts = attempts;
        this.problems = problems != null ? List.copyOf(problems) : List.of();
        this.metrics = metrics != null ? metrics : NodeMetrics.none();
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getAttempts() {
        return attempts;
    }

    public List<String> getProblems() {
        return problems;
    }

    public NodeMetrics getMetrics() {
        return metrics;
    }
}
