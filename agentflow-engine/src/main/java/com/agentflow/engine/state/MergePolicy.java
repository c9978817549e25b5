package com.agentflow.engine.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * How a node delta combines with the current value of a state field.
 */
public enum MergePolicy {

    /** The delta value replaces the current value. */
    LAST_WRITER_WINS {
        @Override
        public Object merge(Object current, Object delta) {
            return delta;
        }
    },

    /** The delta is appended to the current list; a non-list delta is appended as one element. */
    ORDERED_CONCATENATION {
        @Override
        public Object merge(Object current, Object delta) {
            List<Object> out = new ArrayList<>();
            if (current instanceof Collection<?> c) out.addAll(c);
            if (delta instanceof Collection<?> d) {
                out.addAll(d);
            } else if (delta != null) {
                out.add(delta);
            }
            return List.copyOf(out);
        }
    };

    public abstract Object merge(Object current, Object delta);
}
