/**
 * Tool contract for workflow nodes: a node lists tool names, the engine binds the matching
 * {@link com.agentflow.tools.Tool}s to the model and runs requested calls through a {@link com.agentflow.tools.ToolInvoker}.
 * <p>
 * Tools are registered once at process start in an immutable {@link com.agentflow.tools.ToolRegistry}.
 */
package com.agentflow.tools;
