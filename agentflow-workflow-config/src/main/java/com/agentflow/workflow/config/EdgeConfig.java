package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Control-flow declaration leaving {@code from}. Exactly one of:
 * <ul>
 *   <li>{@code to}: a node id or END (linear), or a list of node ids (fork-join fan-out)</li>
 *   <li>{@code routes}: ordered conditional routes with a {@code default} fallback</li>
 *   <li>{@code loop}: bounded loop on the source node</li>
 * </ul>
 * The validator reports declarations with none or several of these.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class EdgeConfig {

    public static final String START = "START";
    public static final String END = "END";

    private final String from;
    private final List<String> targets;
    private final boolean fanOut;
    private final List<RouteConfig> routes;
    private final LoopConfig loop;

    public EdgeConfig(String from, List<String> targets, boolean fanOut, List<RouteConfig> routes, LoopConfig loop) {
        this.from = from != null ? from.trim() : null;
        this.targets = targets != null ? List.copyOf(targets) : List.of();
        this.fanOut = fanOut;
        this.routes = routes != null ? List.copyOf(routes) : List.of();
        this.loop = loop;
    }

    @JsonCreator
    public static EdgeConfig fromJson(
            @JsonProperty("from") String from,
            @JsonProperty("to") Object to,
            @JsonProperty("routes") List<RouteConfig> routes,
            @JsonProperty("loop") LoopConfig loop) {
        List<String> targets = new ArrayList<>();
        boolean fanOut = false;
        if (to instanceof List<?> list) {
            fanOut = true;
            for (Object t : list) {
                if (t != null) targets.add(t.toString().trim());
            }
        } else if (to != null) {
            targets.add(to.toString().trim());
        }
        return new EdgeConfig(from, targets, fanOut, routes, loop);
    }

    public static EdgeConfig linear(String from, String to) {
        return new EdgeConfig(from, List.of(to), false, null, null);
    }

    public static EdgeConfig fork(String from, List<String> targets) {
        return new EdgeConfig(from, targets, true, null, null);
    }

    public static EdgeConfig conditional(String from, List<RouteConfig> routes) {
        return new EdgeConfig(from, null, false, routes, null);
    }

    public static EdgeConfig loop(String from, LoopConfig loop) {
        return new EdgeConfig(from, null, false, null, loop);
    }

    public String getFrom() {
        return from;
    }

    /** Serialized form of {@code to}: a list for fan-out, otherwise the single target (or null). */
    @JsonProperty("to")
    public Object getTo() {
        if (fanOut) return targets;
        return targets.isEmpty() ? null : targets.get(0);
    }

    @JsonIgnore
    public List<String> getTargets() {
        return targets;
    }

    @JsonIgnore
    public boolean isFanOut() {
        return fanOut;
    }

    public List<RouteConfig> getRoutes() {
        return routes;
    }

    public LoopConfig getLoop() {
        return loop;
    }

    @JsonIgnore
    public boolean hasTo() {
        return !targets.isEmpty() || fanOut;
    }

    @JsonIgnore
    public boolean hasRoutes() {
        return !routes.isEmpty();
    }

    @JsonIgnore
    public boolean hasLoop() {
        return loop != null;
    }

    /** Number of edge variants declared; a well-formed edge declares exactly one. */
    @JsonIgnore
    public int declaredVariantCount() {
        int n = 0;
        if (hasTo()) n++;
        if (hasRoutes()) n++;
        if (hasLoop()) n++;
        return n;
    }

    /** Every node id (or END) this edge can transfer control to. */
    @JsonIgnore
    public List<String> allTargets() {
        List<String> out = new ArrayList<>(targets);
        for (RouteConfig r : routes) {
            if (r.getTo() != null) out.add(r.getTo());
        }
        if (loop != null) {
            out.add(from);
            out.add(loop.getExitTo());
        }
        return out;
    }

    /** Short human-readable form used in log lines and error messages. */
    public String describe() {
        if (hasLoop()) return from + " -> loop(exit_to=" + loop.getExitTo() + ")";
        if (hasRoutes()) return from + " -> routes";
        if (fanOut) return from + " -> " + targets;
        return from + " -> " + (targets.isEmpty() ? "?" : targets.get(0));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeConfig that = (EdgeConfig) o;
        return fanOut == that.fanOut
                && Objects.equals(from, that.from)
                && Objects.equals(targets, that.targets)
                && Objects.equals(routes, that.routes)
                && Objects.equals(loop, that.loop);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, targets, fanOut, routes, loop);
    }

    @Override
    public String toString() {
        return describe();
    }
}
