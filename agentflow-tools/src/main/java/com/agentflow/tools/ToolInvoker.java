package com.agentflow.tools;

import java.util.Map;

/** Runs a tool by name. */
public interface ToolInvoker {

    /**
     * @throws ToolExecutionException when the tool is unknown or fails
     */
    Object invoke(String name, Map<String, Object> arguments);
}
