package com.agentflow.engine.run;

import com.agentflow.engine.gates.QualityGateException;
import com.agentflow.engine.graph.ControlFlowException;
import com.agentflow.engine.node.NodeExecutionException;
import com.agentflow.engine.output.OutputValidationException;
import com.agentflow.engine.state.StateInitializationException;
import com.agentflow.engine.template.TemplateException;
import com.agentflow.llm.LlmException;
import com.agentflow.tools.ToolExecutionException;
import com.agentflow.workflow.condition.ConditionSyntaxException;
import com.agentflow.workflow.load.WorkflowConfigLoadException;
import com.agentflow.workflow.validation.ConfigValidationException;
import com.agentflow.workflow.validation.Violation;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Structured error of a failed run: kind, message, the node it happened in (when any) and, for config
 * errors, every violation found.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class RunError {

    private final ErrorKind kind;
    private final String message;
    private final String nodeId;
    private final List<Violation> violations;

    public RunError(ErrorKind kind, String message, String nodeId, List<Violation> violations) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message != null ? message : kind.toValue();
        this.nodeId = nodeId;
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    /** Classifies an exception raised anywhere between loading and finalizing a run. */
    public static RunError from(Throwable t) {
        if (t instanceof NodeExecutionException ne) {
            Throwable cause = ne.getCause();
            if (cause != null && !(cause instanceof NodeExecutionException)) {
                RunError inner = from(cause);
                if (inner.kind != ErrorKind.INTERNAL) {
                    return new RunError(inner.kind, inner.message, ne.getNodeId(), inner.violations);
                }
            }
            return new RunError(ErrorKind.NODE_EXECUTION, ne.getMessage(), ne.getNodeId(), null);
        }
        if (t instanceof ConfigValidationException ce) {
            return new RunError(ErrorKind.CONFIG_VALIDATION, ce.getMessage(), null, ce.getViolations());
        }
        if (t instanceof WorkflowConfigLoadException) {
            return new RunError(ErrorKind.CONFIG_LOAD, t.getMessage(), null, null);
        }
        if (t instanceof StateInitializationException) {
            return new RunError(ErrorKind.STATE_INITIALIZATION, t.getMessage(), null, null);
        }
        if (t instanceof TemplateException) {
            return new RunError(ErrorKind.TEMPLATE, t.getMessage(), null, null);
        }
        if (t instanceof ToolExecutionException) {
            return new RunError(ErrorKind.TOOL_EXECUTION, t.getMessage(), null, null);
        }
        if (t instanceof OutputValidationException oe) {
            return new RunError(ErrorKind.OUTPUT_VALIDATION, oe.getMessage(), oe.getNodeId(), null);
        }
        if (t instanceof ControlFlowException cfe) {
            return new RunError(ErrorKind.CONTROL_FLOW, cfe.getMessage(), cfe.getNodeId(), null);
        }
        if (t instanceof ConditionSyntaxException) {
            return new RunError(ErrorKind.CONTROL_FLOW, t.getMessage(), null, null);
        }
        if (t instanceof WorkflowTimeoutException) {
            return new RunError(ErrorKind.TIMEOUT, t.getMessage(), null, null);
        }
        if (t instanceof QualityGateException) {
            return new RunError(ErrorKind.QUALITY_GATE, t.getMessage(), null, null);
        }
        if (t instanceof LlmException) {
            return new RunError(ErrorKind.LLM, t.getMessage(), null, null);
        }
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new RunError(ErrorKind.INTERNAL, message, null, null);
    }

    @JsonIgnore
    public ErrorKind getKind() {
        return kind;
    }

    @JsonProperty("kind")
    public String getKindValue() {
        return kind.toValue();
    }

    public String getMessage() {
        return message;
    }

    @JsonProperty("node_id")
    public String getNodeId() {
        return nodeId;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    @Override
    public String toString() {
        return kind.toValue() + (nodeId != null ? " [" + nodeId + "]" : "") + ": " + message;
    }
}
