package io.bibliotek.upload.exception;

/**
 * Completion was refused. The session is still open and completion can be retried once
 * the reported problem is fixed.
 */
public class CompletionFailedException extends UploadException {

    public CompletionFailedException(String message) {
        super(message);
    }

    public CompletionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
