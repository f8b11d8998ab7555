package io.bibliotek.storage.api.exception;

/**
 * The object store could not be reached (network, DNS, timeouts).
 */
public class StorageConnectivityException extends StorageException {

    public StorageConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
