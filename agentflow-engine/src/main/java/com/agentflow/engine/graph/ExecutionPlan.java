package com.agentflow.engine.graph;

import com.agentflow.engine.node.NodeDescriptor;
import com.agentflow.engine.state.StateRecordType;
import com.agentflow.workflow.config.EdgeConfig;
import com.agentflow.workflow.config.GatesConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of {@link GraphCompiler}: node descriptors, one compiled edge per source (START included),
 * the state record type, the run timeout and the quality gates. Immutable; safe to share across runs.
 */
public final class ExecutionPlan {

    private final String workflowName;
    private final String workflowVersion;
    private final StateRecordType stateType;
    private final Map<String, NodeDescriptor> nodes;
    private final Map<String, EdgeDescriptor> edges;
    private final Duration timeout;
    private final GatesConfig gates;

    ExecutionPlan(String workflowName, String workflowVersion, StateRecordType stateType,
                  Map<String, NodeDescriptor> nodes, Map<String, EdgeDescriptor> edges,
                  Duration timeout, GatesConfig gates) {
        this.workflowName = workflowName;
        this.workflowVersion = workflowVersion;
        this.stateType = stateType;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        this.timeout = timeout;
        this.gates = gates;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getWorkflowVersion() {
        return workflowVersion;
    }

    public StateRecordType getStateType() {
        return stateType;
    }

    public Map<String, NodeDescriptor> getNodes() {
        return nodes;
    }

    public NodeDescriptor node(String id) {
        NodeDescriptor d = nodes.get(id);
        if (d == null) {
            throw new ControlFlowException(id, "Plan has no node '" + id + "'");
        }
        return d;
    }

    public Optional<EdgeDescriptor> findEdge(String source) {
        return Optional.ofNullable(edges.get(source));
    }

    /**
     * Edge leaving {@code source}.
     *
     * @throws ControlFlowException when the source has no outgoing edge
     */
    public EdgeDescriptor edgeFrom(String source) {
        EdgeDescriptor e = edges.get(source);
        if (e == null) {
            throw new ControlFlowException(source, "No outgoing edge from '" + source + "'");
        }
        return e;
    }

    public EdgeDescriptor entryEdge() {
        return edgeFrom(EdgeConfig.START);
    }

    public Duration getTimeout() {
        return timeout;
    }

    /** Quality gates from {@code config.gates}; null when none are configured. */
    public GatesConfig getGates() {
        return gates;
    }

    /** Edge descriptions in compile order (declared edges first, then node-level loops). */
    public List<EdgeDescription> describeEdges() {
        List<EdgeDescription> out = new ArrayList<>(edges.size());
        for (EdgeDescriptor e : edges.values()) {
            out.add(e.describe());
        }
        return out;
    }
}
