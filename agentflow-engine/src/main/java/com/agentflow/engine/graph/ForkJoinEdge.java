package com.agentflow.engine.graph;

import java.util.List;
import java.util.Objects;

/**
 * Fan-out to two or more branches that run concurrently on the same snapshot and rejoin at
 * {@code joinNode} (END when the branches only meet at the end of the workflow).
 */
public final class ForkJoinEdge extends EdgeDescriptor {

    private final List<String> branches;
    private final String joinNode;

    public ForkJoinEdge(String source, List<String> branches, String joinNode) {
        super(source);
        this.branches = List.copyOf(branches);
        this.joinNode = Objects.requireNonNull(joinNode, "joinNode");
    }

    /** Branch start nodes in declaration order; this is also the merge order at the join. */
    public List<String> getBranches() {
        return branches;
    }

    public String getJoinNode() {
        return joinNode;
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.FORK_JOIN;
    }

    @Override
    public List<String> successors() {
        return branches;
    }

    @Override
    public EdgeDescription describe() {
        return new EdgeDescription(EdgeKind.FORK_JOIN, getSource(), branches, null, null, null, null, joinNode);
    }
}
