package com.agentflow.workflow.condition;

import java.util.Map;
import java.util.Set;

/**
 * Compiled route predicate. Evaluation reads state values only and has no side effects.
 */
public interface Condition {

    /** The {@code default} route condition. */
    Condition ALWAYS = new Condition() {
        @Override
        public boolean test(Map<String, Object> state) {
            return true;
        }

        @Override
        public Set<String> referencedFields() {
            return Set.of();
        }

        @Override
        public String toString() {
            return "default";
        }
    };

    boolean test(Map<String, Object> state);

    /** Root state field names the expression reads. */
    Set<String> referencedFields();
}
