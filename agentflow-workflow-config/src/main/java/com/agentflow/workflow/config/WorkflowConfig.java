package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of a workflow document: flow metadata, state schema, nodes, edges and global settings.
 * Immutable once parsed; the validator and compiler only read it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkflowConfig {

    public static final String SUPPORTED_SCHEMA_VERSION = "1.0";

    private final String schemaVersion;
    private final FlowMetadata flow;
    private final StateSchema state;
    private final List<NodeConfig> nodes;
    private final List<EdgeConfig> edges;
    private final GlobalSettings config;

    @JsonCreator
    public WorkflowConfig(
            @JsonProperty("schema_version") String schemaVersion,
            @JsonProperty("flow") FlowMetadata flow,
            @JsonProperty("state") StateSchema state,
            @JsonProperty("nodes") List<NodeConfig> nodes,
            @JsonProperty("edges") List<EdgeConfig> edges,
            @JsonProperty("config") GlobalSettings config) {
        this.schemaVersion = schemaVersion;
        this.flow = flow;
        this.state = state != null ? state : new StateSchema(List.of());
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.config = config != null ? config : GlobalSettings.empty();
    }

    @JsonProperty("schema_version")
    public String getSchemaVersion() {
        return schemaVersion;
    }

    public FlowMetadata getFlow() {
        return flow;
    }

    /** Flow name, or "unnamed" when the document has no flow block. */
    @JsonIgnore
    public String getName() {
        return flow != null && flow.getName() != null && !flow.getName().isBlank() ? flow.getName() : "unnamed";
    }

    public StateSchema getState() {
        return state;
    }

    public List<NodeConfig> getNodes() {
        return nodes;
    }

    public List<EdgeConfig> getEdges() {
        return edges;
    }

    public GlobalSettings getConfig() {
        return config;
    }

    public Optional<NodeConfig> findNode(String id) {
        if (id == null) return Optional.empty();
        for (NodeConfig n : nodes) {
            if (id.equals(n.getId())) return Optional.of(n);
        }
        return Optional.empty();
    }

    @JsonIgnore
    public List<String> nodeIds() {
        List<String> ids = new ArrayList<>(nodes.size());
        for (NodeConfig n : nodes) {
            ids.add(n.getId());
        }
        return ids;
    }

    /**
     * Declared edges followed by one loop edge per node that carries a node-level {@code loop} block,
     * in node declaration order.
     */
    @JsonIgnore
    public List<EdgeConfig> effectiveEdges() {
        List<EdgeConfig> out = new ArrayList<>(edges);
        for (NodeConfig n : nodes) {
            if (n.getLoop() != null) {
                out.add(EdgeConfig.loop(n.getId(), n.getLoop()));
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowConfig that = (WorkflowConfig) o;
        return Objects.equals(schemaVersion, that.schemaVersion)
                && Objects.equals(flow, that.flow)
                && Objects.equals(state, that.state)
                && Objects.equals(nodes, that.nodes)
                && Objects.equals(edges, that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaVersion, flow, state, nodes, edges);
    }
}
