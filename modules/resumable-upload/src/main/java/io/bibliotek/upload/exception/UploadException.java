package io.bibliotek.upload.exception;

/**
 * Base class of every failure the upload coordinator reports to its callers.
 */
public abstract class UploadException extends RuntimeException {

    protected UploadException(String message) {
        super(message);
    }

    protected UploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
