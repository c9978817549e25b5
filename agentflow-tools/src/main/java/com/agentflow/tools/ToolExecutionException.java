package com.agentflow.tools;

/**
 * A tool call failed: unknown tool, bad arguments or an error raised by the tool itself.
 * Inside a node's tool loop this is reported back to the model rather than failing the node.
 */
public final class ToolExecutionException extends RuntimeException {

    private final String toolName;

    public ToolExecutionException(String toolName, String message) {
        this(toolName, message, null);
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
