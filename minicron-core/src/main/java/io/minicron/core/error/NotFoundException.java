package io.minicron.core.error;

public final class NotFoundException extends MinicronException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException job(String id) {
        return new NotFoundException("cron job not found: " + id);
    }
}
