package com.agentflow.workflow.condition;

/**
 * Thrown when a route condition is not a supported expression.
 */
public final class ConditionSyntaxException extends RuntimeException {

    private final String expression;
    private final int position;

    public ConditionSyntaxException(String expression, int position, String message) {
        super(message + " at position " + position + " in '" + expression + "'");
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
