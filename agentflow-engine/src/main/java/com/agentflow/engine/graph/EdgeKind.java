package com.agentflow.engine.graph;

/** Compiled edge variants. */
public enum EdgeKind {
    LINEAR,
    CONDITIONAL,
    LOOP,
    FORK_JOIN
}
