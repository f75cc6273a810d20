package io.minicron.core.error;

public final class StorageException extends MinicronException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
