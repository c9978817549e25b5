package com.agentflow.engine.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Serializable description of one compiled edge. {@code conditions} lines up with {@code targets}
 * for conditional edges; loop and join fields are null for other kinds.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class EdgeDescription {

    private final EdgeKind kind;
    private final String source;
    private final List<String> targets;
    private final List<String> conditions;
    private final Integer maxIterations;
    private final String conditionField;
    private final String exitTo;
    private final String joinNode;

    @JsonCreator
    public EdgeDescription(
            @JsonProperty("kind") EdgeKind kind,
            @JsonProperty("source") String source,
            @JsonProperty("targets") List<String> targets,
            @JsonProperty("conditions") List<String> conditions,
            @JsonProperty("max_iterations") Integer maxIterations,
            @JsonProperty("condition_field") String conditionField,
            @JsonProperty("exit_to") String exitTo,
            @JsonProperty("join_node") String joinNode) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.source = Objects.requireNonNull(source, "source");
        this.targets = targets != null ? List.copyOf(targets) : List.of();
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.maxIterations = maxIterations;
        this.conditionField = conditionField;
        this.exitTo = exitTo;
        this.joinNode = joinNode;
    }

    public EdgeKind getKind() { return kind; }
    public String getSource() { return source; }
    public List<String> getTargets() { return targets; }
    public List<String> getConditions() { return conditions; }

    @JsonProperty("max_iterations")
    public Integer getMaxIterations() { return maxIterations; }

    @JsonProperty("condition_field")
    public String getConditionField() { return conditionField; }

    @JsonProperty("exit_to")
    public String getExitTo() { return exitTo; }

    @JsonProperty("join_node")
    public String getJoinNode() { return joinNode; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeDescription that = (EdgeDescription) o;
        return kind == that.kind
                && source.equals(that.source)
                && targets.equals(that.targets)
                && conditions.equals(that.conditions)
                && Objects.equals(maxIterations, that.maxIterations)
                && Objects.equals(conditionField, that.conditionField)
                && Objects.equals(exitTo, that.exitTo)
                && Objects.equals(joinNode, that.joinNode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, source, targets, conditions, maxIterations, conditionField, exitTo, joinNode);
    }

    @Override
    public String toString() {
        return kind + " " + source + " -> " + targets;
    }
}
