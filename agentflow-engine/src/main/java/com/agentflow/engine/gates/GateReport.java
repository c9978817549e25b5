package com.agentflow.engine.gates;

import com.agentflow.workflow.config.GateAction;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** All gate results of a run plus the configured {@code on_fail} action. */
public final class GateReport {

    private final List<GateResult> results;
    private final GateAction onFail;

    public GateReport(List<GateResult> results, GateAction onFail) {
        this.results = results != null ? List.copyOf(results) : List.of();
        this.onFail = onFail != null ? onFail : GateAction.WARN;
    }

    public List<GateResult> getResults() {
        return results;
    }

    @JsonProperty("on_fail")
    public GateAction getOnFail() {
        return onFail;
    }

    @JsonIgnore
    public List<GateResult> getFailed() {
        List<GateResult> out = new ArrayList<>();
        for (GateResult r : results) {
            if (!r.isPassed()) out.add(r);
        }
        return out;
    }

    @JsonProperty("passed")
    public boolean allPassed() {
        return getFailed().isEmpty();
    }
}
