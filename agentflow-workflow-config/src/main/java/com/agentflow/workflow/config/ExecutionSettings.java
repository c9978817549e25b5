package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code config.execution}: overall run timeout in seconds, structured-output retry limit and the
 * tool-calling loop cap. Null means "use the process default".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionSettings {

    private final Integer timeout;
    private final Integer maxRetries;
    private final Integer toolLoopMaxIterations;

    @JsonCreator
    public ExecutionSettings(
            @JsonProperty("timeout") Integer timeout,
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("tool_loop_max_iterations") Integer toolLoopMaxIterations) {
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.toolLoopMaxIterations = toolLoopMaxIterations;
    }

    public Integer getTimeout() {
        return timeout;
    }

    @JsonProperty("max_retries")
    public Integer getMaxRetries() {
        return maxRetries;
    }

    @JsonProperty("tool_loop_max_iterations")
    public Integer getToolLoopMaxIterations() {
        return toolLoopMaxIterations;
    }
}
