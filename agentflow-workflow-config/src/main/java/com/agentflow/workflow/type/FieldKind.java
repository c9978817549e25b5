package com.agentflow.workflow.type;

/** Kind of a parsed type string. */
public enum FieldKind {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    LIST,
    DICT,
    OBJECT;

    public boolean isScalar() {
        return this == STRING || this == INTEGER || this == FLOAT || this == BOOLEAN;
    }
}
