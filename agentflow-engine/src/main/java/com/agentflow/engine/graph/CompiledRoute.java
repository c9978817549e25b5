package com.agentflow.engine.graph;

import com.agentflow.workflow.condition.Condition;

import java.util.Objects;

/** One route of a conditional edge: the source text, its compiled predicate and the target. */
public final class CompiledRoute {

    private final String logic;
    private final Condition condition;
    private final String target;
    private final boolean isDefault;

    public CompiledRoute(String logic, Condition condition, String target, boolean isDefault) {
        this.logic = logic;
        this.condition = Objects.requireNonNull(condition, "condition");
        this.target = Objects.requireNonNull(target, "target");
        this.isDefault = isDefault;
    }

    public String getLogic() {
        return logic;
    }

    public Condition getCondition() {
        return condition;
    }

    public String getTarget() {
        return target;
    }

    public boolean isDefault() {
        return isDefault;
    }
}
