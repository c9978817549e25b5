package com.agentflow.engine.graph;

import com.agentflow.engine.state.ExecutionState;

import java.util.List;
import java.util.Objects;

/**
 * Bounded self loop on the source node. After each body execution the loop exits to {@code exitTo}
 * when {@code conditionField} is true or {@code maxIterations} body executions have happened;
 * otherwise the body runs again. Hitting the cap is not an error.
 */
public final class LoopEdge extends EdgeDescriptor {

    private final int maxIterations;
    private final String conditionField;
    private final String exitTo;

    public LoopEdge(String source, int maxIterations, String conditionField, String exitTo) {
        super(source);
        this.maxIterations = maxIterations;
        this.conditionField = Objects.requireNonNull(conditionField, "conditionField");
        this.exitTo = Objects.requireNonNull(exitTo, "exitTo");
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public String getConditionField() {
        return conditionField;
    }

    public String getExitTo() {
        return exitTo;
    }

    /**
     * @param iterations body executions so far, including the one that just finished
     */
    public Decision decide(ExecutionState state, int iterations) {
        if (Boolean.TRUE.equals(state.asMap().get(conditionField))) {
            return new Decision(exitTo, true, false);
        }
        if (iterations >= maxIterations) {
            return new Decision(exitTo, true, true);
        }
        return new Decision(getSource(), false, false);
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.LOOP;
    }

    @Override
    public List<String> successors() {
        return List.of(getSource(), exitTo);
    }

    @Override
    public EdgeDescription describe() {
        return new EdgeDescription(EdgeKind.LOOP, getSource(), successors(), null, maxIterations, conditionField, exitTo, null);
    }

    /** Where the loop goes next and whether it left because the iteration cap was reached. */
    public static final class Decision {
        private final String target;
        private final boolean exited;
        private final boolean capHit;

        Decision(String target, boolean exited, boolean capHit) {
            this.target = target;
            this.exited = exited;
            this.capHit = capHit;
        }

        public String getTarget() { return target; }
        public boolean isExited() { return exited; }
        public boolean isCapHit() { return capHit; }
    }
}
