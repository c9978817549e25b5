package com.agentflow.engine.run;

import com.agentflow.ledger.NodeMetrics;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated metrics of a run: totals over every node execution (loop iterations count separately),
 * the per-node list in completion order, loop cap hits and the slowest node.
 * Gate metric names are listed in {@link #toMetricMap()}.
 */
public final class RunMetrics {

    private final long durationMs;
    private final List<NodeRun> nodes;
    private final List<String> loopCapHits;

    public RunMetrics(long durationMs, List<NodeRun> nodes, List<String> loopCapHits) {
        this.durationMs = durationMs;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.loopCapHits = loopCapHits != null ? List.copyOf(loopCapHits) : List.of();
    }

    public static RunMetrics empty(long durationMs) {
        return new RunMetrics(durationMs, List.of(), List.of());
    }

    @JsonProperty("duration_ms")
    public long getDurationMs() {
        return durationMs;
    }

    public List<NodeRun> getNodes() {
        return nodes;
    }

    /** Loop source nodes whose {@code max_iterations} was reached before the exit condition held. */
    @JsonProperty("loop_cap_hits")
    public List<String> getLoopCapHits() {
        return loopCapHits;
    }

    @JsonProperty("node_count")
    public int getNodeCount() {
        return nodes.size();
    }

    @JsonProperty("prompt_tokens")
    public long getPromptTokens() {
        long sum = 0;
        for (NodeRun n : nodes) sum += n.getMetrics().getPromptTokens();
        return sum;
    }

    @JsonProperty("completion_tokens")
    public long getCompletionTokens() {
        long sum = 0;
        for (NodeRun n : nodes) sum += n.getMetrics().getCompletionTokens();
        return sum;
    }

    @JsonProperty("total_tokens")
    public long getTotalTokens() {
        return getPromptTokens() + getCompletionTokens();
    }

    @JsonProperty("cost_usd")
    public BigDecimal getCostUsd() {
        BigDecimal sum = BigDecimal.ZERO;
        for (NodeRun n : nodes) sum = sum.add(n.getMetrics().getCostUsd());
        return sum;
    }

    @JsonProperty("tool_calls")
    public int getToolCalls() {
        int sum = 0;
        for (NodeRun n : nodes) sum += n.getMetrics().getToolCalls();
        return sum;
    }

    /** Id of the node execution with the longest duration; null when no node ran. */
    @JsonProperty("slowest_node")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getSlowestNode() {
        NodeRun slowest = null;
        for (NodeRun n : nodes) {
            if (slowest == null || n.getMetrics().getDurationMs() > slowest.getMetrics().getDurationMs()) slowest = n;
        }
        return slowest != null ? slowest.getNodeId() : null;
    }

    /**
     * Metrics addressable by quality gates: {@code cost_usd}, {@code total_tokens}, {@code prompt_tokens},
     * {@code completion_tokens}, {@code duration_ms}, {@code node_count}, {@code tool_calls}.
     */
    @JsonIgnore
    public Map<String, Double> toMetricMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("cost_usd", getCostUsd().doubleValue());
        out.put("total_tokens", (double) getTotalTokens());
        out.put("prompt_tokens", (double) getPromptTokens());
        out.put("completion_tokens", (double) getCompletionTokens());
        out.put("duration_ms", (double) durationMs);
        out.put("node_count", (double) getNodeCount());
        out.put("tool_calls", (double) getToolCalls());
        return Collections.unmodifiableMap(out);
    }

    /** Thread-safe accumulator filled by node executions of one run, fork branches included. */
    static final class Collector {
        private final List<NodeRun> nodes = new ArrayList<>();
        private final List<String> loopCapHits = new ArrayList<>();

        synchronized void node(String nodeId, NodeMetrics metrics, String error) {
            nodes.add(new NodeRun(nodeId, metrics, error));
        }

        synchronized void loopCapHit(String nodeId) {
            loopCapHits.add(nodeId);
        }

        synchronized RunMetrics snapshot(long durationMs) {
            return new RunMetrics(durationMs, nodes, loopCapHits);
        }
    }
}
