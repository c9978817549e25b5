package com.agentflow.llm;

/** The provider call failed (transport, HTTP status or unreadable response). */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
