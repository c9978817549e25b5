package com.agentflow.engine.output;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of checking a raw model response against an {@link OutputContract}: either the typed delta
 * (keyed by state field) or the list of problems found.
 */
public final class OutputCheck {

    private final Map<String, Object> delta;
    private final List<String> problems;

    private OutputCheck(Map<String, Object> delta, List<String> problems) {
        this.delta = delta;
        this.problems = problems;
    }

    public static OutputCheck valid(Map<String, Object> delta) {
        return new OutputCheck(Collections.unmodifiableMap(new LinkedHashMap<>(delta)), List.of());
    }

    public static OutputCheck invalid(List<String> problems) {
        return new OutputCheck(null, List.copyOf(problems));
    }

    public boolean isValid() {
        return problems.isEmpty();
    }

    /** Typed delta keyed by state field name; null when invalid. */
    public Map<String, Object> getDelta() {
        return delta;
    }

    public List<String> getProblems() {
        return problems;
    }
}
