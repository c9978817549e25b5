package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * One conditional route. The condition is either {@code {logic: "..."}} or a bare string;
 * the literal {@value #DEFAULT_LOGIC} matches unconditionally.
 */
public final class RouteConfig {

    public static final String DEFAULT_LOGIC = "default";

    private final String logic;
    private final String to;

    public RouteConfig(String logic, String to) {
        this.logic = logic != null ? logic.trim() : null;
        this.to = to != null ? to.trim() : null;
    }

    @JsonCreator
    public static RouteConfig fromJson(
            @JsonProperty("condition") Object condition,
            @JsonProperty("to") String to) {
        String logic = null;
        if (condition instanceof Map<?, ?> map) {
            Object l = map.get("logic");
            logic = l != null ? l.toString() : null;
        } else if (condition != null) {
            logic = condition.toString();
        }
        return new RouteConfig(logic, to);
    }

    @JsonIgnore
    public String getLogic() {
        return logic;
    }

    @JsonProperty("condition")
    public Map<String, String> getCondition() {
        return logic != null ? Map.of("logic", logic) : Map.of();
    }

    public String getTo() {
        return to;
    }

    @JsonIgnore
    public boolean isDefault() {
        return DEFAULT_LOGIC.equals(logic);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RouteConfig that = (RouteConfig) o;
        return Objects.equals(logic, that.logic) && Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logic, to);
    }
}
