package io.minicron.core.error;

public final class UnschedulableException extends ValidationException {

    public UnschedulableException(String expression, int horizonYears) {
        super(ErrorKind.UNSCHEDULABLE,
            "cron expression '" + expression + "' has no occurrence within " + horizonYears + " years");
    }
}
