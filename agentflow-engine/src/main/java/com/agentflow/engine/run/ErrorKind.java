package com.agentflow.engine.run;

/** Classification of the error that failed a run (or a node that was allowed to fail). */
public enum ErrorKind {
    CONFIG_LOAD,
    CONFIG_VALIDATION,
    STATE_INITIALIZATION,
    TEMPLATE,
    TOOL_EXECUTION,
    OUTPUT_VALIDATION,
    CONTROL_FLOW,
    TIMEOUT,
    QUALITY_GATE,
    LLM,
    NODE_EXECUTION,
    INTERNAL;

    public String toValue() {
        return name().toLowerCase();
    }
}
