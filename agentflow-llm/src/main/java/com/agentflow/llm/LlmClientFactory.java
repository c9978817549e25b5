package com.agentflow.llm;

/** Creates a client for the resolved settings of one node. Built once per process and shared. */
@FunctionalInterface
public interface LlmClientFactory {

    /**
     * @throws LlmException when the provider is not supported
     */
    LlmClient create(LlmOptions options);
}
