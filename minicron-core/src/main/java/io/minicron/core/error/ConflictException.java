package io.minicron.core.error;

public final class ConflictException extends MinicronException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
