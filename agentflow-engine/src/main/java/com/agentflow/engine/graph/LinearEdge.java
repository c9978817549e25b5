package com.agentflow.engine.graph;

import java.util.List;
import java.util.Objects;

/** Single successor, no decision. */
public final class LinearEdge extends EdgeDescriptor {

    private final String target;

    public LinearEdge(String source, String target) {
        super(source);
        this.target = Objects.requireNonNull(target, "target");
    }

    public String getTarget() {
        return target;
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.LINEAR;
    }

    @Override
    public List<String> successors() {
        return List.of(target);
    }

    @Override
    public EdgeDescription describe() {
        return new EdgeDescription(EdgeKind.LINEAR, getSource(), List.of(target), null, null, null, null, null);
    }
}
