package com.agentflow.engine.node;

import com.agentflow.engine.state.ExecutionState;

/**
 * Stateless executor of one node. Reads the snapshot, returns a delta; never mutates shared state.
 * Implementations are called concurrently by fork-join branches.
 */
@FunctionalInterface
public interface NodeHandler {

    NodeResult execute(NodeDescriptor node, ExecutionState snapshot);
}
