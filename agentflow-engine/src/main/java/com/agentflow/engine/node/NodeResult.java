package com.agentflow.engine.node;

import com.agentflow.ledger.NodeMetrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one node execution: the state delta (declared output fields only) and its metrics.
 */
public final class NodeResult {

    private final String nodeId;
    private final Map<String, Object> delta;
    private final NodeMetrics metrics;

    public NodeResult(String nodeId, Map<String, Object> delta, NodeMetrics metrics) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.delta = delta != null ? Collections.unmodifiableMap(new LinkedHashMap<>(delta)) : Map.of();
        this.metrics = metrics != null ? metrics : NodeMetrics.none();
    }

    public String getNodeId() {
        return nodeId;
    }

    public Map<String, Object> getDelta() {
        return delta;
    }

    public NodeMetrics getMetrics() {
        return metrics;
    }
}
