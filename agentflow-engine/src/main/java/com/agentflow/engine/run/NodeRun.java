package com.agentflow.engine.run;

import com.agentflow.ledger.NodeMetrics;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One node execution within a run; {@code error} is set when the node failed. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NodeRun {

    private final String nodeId;
    private final NodeMetrics metrics;
    private final String error;

    public NodeRun(String nodeId, NodeMetrics metrics, String error) {
        this.nodeId = nodeId;
        this.metrics = metrics != null ? metrics : NodeMetrics.none();
        this.error = error;
    }

    @JsonProperty("node_id")
    public String getNodeId() {
        return nodeId;
    }

    public NodeMetrics getMetrics() {
        return metrics;
    }

    public String getError() {
        return error;
    }
}
