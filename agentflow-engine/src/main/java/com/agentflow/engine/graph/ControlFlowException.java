package com.agentflow.engine.graph;

/**
 * Thrown when the compiled graph cannot decide where to go next (no route matched and no default,
 * or a node without an outgoing edge). Validation rules these out, so this indicates a validator gap.
 */
public final class ControlFlowException extends RuntimeException {

    private final String nodeId;

    public ControlFlowException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
