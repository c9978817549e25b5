package com.agentflow.engine.graph;

import java.util.List;
import java.util.Objects;

/**
 * Compiled control flow leaving one node (or START). Subclasses hold the decision logic
 * for their variant; the orchestrator dispatches on {@link #getKind()}.
 */
public abstract class EdgeDescriptor {

    private final String source;

    protected EdgeDescriptor(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public String getSource() {
        return source;
    }

    public abstract EdgeKind getKind();

    /** Every node id (or END) control can move to from here. */
    public abstract List<String> successors();

    public abstract EdgeDescription describe();

    @Override
    public String toString() {
        return describe().toString();
    }
}
