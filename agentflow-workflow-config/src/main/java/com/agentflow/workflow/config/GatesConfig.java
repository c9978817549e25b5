package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** {@code config.gates}: thresholds checked after the run and the action taken when any fails. */
public final class GatesConfig {

    private final List<QualityGateConfig> gates;
    private final GateAction onFail;

    @JsonCreator
    public GatesConfig(
            @JsonProperty("gates") List<QualityGateConfig> gates,
            @JsonProperty("on_fail") GateAction onFail) {
        this.gates = gates != null ? List.copyOf(gates) : List.of();
        this.onFail = onFail != null ? onFail : GateAction.WARN;
    }

    public List<QualityGateConfig> getGates() {
        return gates;
    }

    @JsonProperty("on_fail")
    public GateAction getOnFail() {
        return onFail;
    }
}
