package com.agentflow.workflow.type;

/** Thrown when a config type string (e.g. {@code list[strr]}) cannot be parsed. */
public final class TypeParseException extends RuntimeException {

    private final String typeString;

    public TypeParseException(String typeString, String message) {
        super("Invalid type '" + typeString + "': " + message);
        this.typeString = typeString;
    }

    public String getTypeString() {
        return typeString;
    }
}
