package io.bibliotek.storage.api.exception;

/**
 * Base class for failures reported by an object store.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
