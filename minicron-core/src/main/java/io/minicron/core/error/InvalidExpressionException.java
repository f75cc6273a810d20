package io.minicron.core.error;

public final class InvalidExpressionException extends ValidationException {
    private final String expression;

    public InvalidExpressionException(String expression, String reason) {
        super("invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
