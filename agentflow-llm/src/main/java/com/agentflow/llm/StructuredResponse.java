package com.agentflow.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response of a schema-constrained call. {@code value} is the parsed JSON object, or null when the
 * provider returned text that is not a JSON object; {@code rawText} keeps what the model actually said.
 */
public final class StructuredResponse {

    private final Map<String, Object> value;
    private final String rawText;
    private final TokenUsage usage;
    private final String model;

    public StructuredResponse(Map<String, Object> value, String rawText, TokenUsage usage, String model) {
        this.value = value != null ? Collections.unmodifiableMap(new LinkedHashMap<>(value)) : null;
        this.rawText = rawText != null ? rawText : "";
        this.usage = usage != null ? usage : TokenUsage.zero();
        this.model = model;
    }

    public static StructuredResponse of(Map<String, Object> value) {
        return new StructuredResponse(value, null, TokenUsage.zero(), null);
    }

    public Map<String, Object> getValue() {
        return value;
    }

    public boolean isParsed() {
        return value != null;
    }

    public String getRawText() {
        return rawText;
    }

    public TokenUsage getUsage() {
        return usage;
    }

    public String getModel() {
        return model;
    }
}
