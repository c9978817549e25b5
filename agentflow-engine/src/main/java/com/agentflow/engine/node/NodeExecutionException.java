package com.agentflow.engine.node;

/**
 * Node failure carrying the id of the node that failed. The cause holds the original error.
 */
public final class NodeExecutionException extends RuntimeException {

    private final String nodeId;

    public NodeExecutionException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public NodeExecutionException(String nodeId, Throwable cause) {
        this(nodeId, "Node '" + nodeId + "' failed: " + (cause != null ? cause.getMessage() : "unknown error"), cause);
    }

    public String getNodeId() {
        return nodeId;
    }
}
