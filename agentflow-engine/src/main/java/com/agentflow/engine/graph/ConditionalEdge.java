package com.agentflow.engine.graph;

import com.agentflow.engine.state.ExecutionState;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered routes. Non-default routes are tried top to bottom and the first whose predicate holds wins;
 * otherwise the {@code default} route is taken wherever it appears in the list.
 */
public final class ConditionalEdge extends EdgeDescriptor {

    private final List<CompiledRoute> routes;

    public ConditionalEdge(String source, List<CompiledRoute> routes) {
        super(source);
        this.routes = List.copyOf(routes);
    }

    public List<CompiledRoute> getRoutes() {
        return routes;
    }

    /**
     * Selects exactly one route for the given state.
     *
     * @throws ControlFlowException when nothing matches and there is no default route
     */
    public CompiledRoute select(ExecutionState state) {
        CompiledRoute fallback = null;
        for (CompiledRoute route : routes) {
            if (route.isDefault()) {
                if (fallback == null) fallback = route;
                continue;
            }
            if (route.getCondition().test(state.asMap())) {
                return route;
            }
        }
        if (fallback == null) {
            throw new ControlFlowException(getSource(), "No route matched after node '" + getSource()
                    + "' and no default route is declared");
        }
        return fallback;
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.CONDITIONAL;
    }

    @Override
    public List<String> successors() {
        List<String> out = new ArrayList<>();
        for (CompiledRoute r : routes) {
            out.add(r.getTarget());
        }
        return out;
    }

    @Override
    public EdgeDescription describe() {
        List<String> conditions = new ArrayList<>();
        for (CompiledRoute r : routes) {
            conditions.add(r.getLogic());
        }
        return new EdgeDescription(EdgeKind.CONDITIONAL, getSource(), successors(), conditions, null, null, null, null);
    }
}
