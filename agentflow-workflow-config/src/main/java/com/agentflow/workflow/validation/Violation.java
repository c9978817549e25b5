package com.agentflow.workflow.validation;

import java.util.Objects;

/**
 * One config problem: where it is ({@code edges[2]}, {@code nodes[draft]}, ...), what is wrong,
 * and an optional suggested fix (e.g. the nearest existing name for a likely typo).
 */
public final class Violation {

    private final String path;
    private final String message;
    private final String suggestion;

    public Violation(String path, String message, String suggestion) {
        this.path = Objects.requireNonNull(path, "path");
        this.message = Objects.requireNonNull(message, "message");
        this.suggestion = suggestion;
    }

    public static Violation of(String path, String message) {
        return new Violation(path, message, null);
    }

    public String getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    public String getSuggestion() {
        return suggestion;
    }

    public boolean hasSuggestion() {
        return suggestion != null && !suggestion.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Violation that = (Violation) o;
        return path.equals(that.path) && message.equals(that.message) && Objects.equals(suggestion, that.suggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, message, suggestion);
    }

    @Override
    public String toString() {
        return hasSuggestion() ? path + ": " + message + " (" + suggestion + ")" : path + ": " + message;
    }
}
