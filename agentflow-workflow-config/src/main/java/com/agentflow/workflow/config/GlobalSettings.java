package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Top-level {@code config} block: LLM defaults, execution limits and quality gates. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GlobalSettings {

    private final LlmSettings llm;
    private final ExecutionSettings execution;
    private final GatesConfig gates;

    @JsonCreator
    public GlobalSettings(
            @JsonProperty("llm") LlmSettings llm,
            @JsonProperty("execution") ExecutionSettings execution,
            @JsonProperty("gates") GatesConfig gates) {
        this.llm = llm;
        this.execution = execution;
        this.gates = gates;
    }

    public static GlobalSettings empty() {
        return new GlobalSettings(null, null, null);
    }

    public LlmSettings getLlm() {
        return llm;
    }

    public ExecutionSettings getExecution() {
        return execution;
    }

    public GatesConfig getGates() {
        return gates;
    }
}
