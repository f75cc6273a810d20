package io.minicron.core.error;

public class ValidationException extends MinicronException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    protected ValidationException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
