package com.agentflow.llm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Prompt and completion token counts reported by the provider. */
public final class TokenUsage {

    private static final TokenUsage ZERO = new TokenUsage(0, 0);

    private final long promptTokens;
    private final long completionTokens;

    public TokenUsage(long promptTokens, long completionTokens) {
        this.promptTokens = Math.max(0, promptTokens);
        this.completionTokens = Math.max(0, completionTokens);
    }

    public static TokenUsage zero() {
        return ZERO;
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) return this;
        return new TokenUsage(promptTokens + other.promptTokens, completionTokens + other.completionTokens);
    }

    @JsonProperty("prompt_tokens")
    public long getPromptTokens() {
        return promptTokens;
    }

    @JsonProperty("completion_tokens")
    public long getCompletionTokens() {
        return completionTokens;
    }

    @JsonIgnore
    public long getTotalTokens() {
        return promptTokens + completionTokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenUsage that = (TokenUsage) o;
        return promptTokens == that.promptTokens && completionTokens == that.completionTokens;
    }

    @Override
    public int hashCode() {
        return Objects.hash(promptTokens, completionTokens);
    }

    @Override
    public String toString() {
        return "TokenUsage{prompt=" + promptTokens + ", completion=" + completionTokens + "}";
    }
}
