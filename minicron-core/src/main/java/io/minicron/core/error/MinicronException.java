package io.minicron.core.error;

import java.util.Objects;

public abstract class MinicronException extends RuntimeException {
    private final ErrorKind kind;

    protected MinicronException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    protected MinicronException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind kind() {
        return kind;
    }
}
