package io.minicron.core.error;

public enum ErrorKind {
    VALIDATION("validation_error", 400),
    UNSCHEDULABLE("unschedulable", 400),
    NOT_FOUND("not_found", 404),
    CONFLICT("conflict", 409),
    STORAGE("storage_error", 500),
    INTERNAL("internal_error", 500);

    private final String wireName;
    private final int httpStatus;

    ErrorKind(String wireName, int httpStatus) {
        this.wireName = wireName;
        this.httpStatus = httpStatus;
    }

    public String wireName() {
        return wireName;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
