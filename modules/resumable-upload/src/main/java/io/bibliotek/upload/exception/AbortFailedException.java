package io.bibliotek.upload.exception;

public class AbortFailedException extends UploadException {

    public AbortFailedException(String uploadId, Throwable cause) {
        super("Failed to abort upload " + uploadId, cause);
    }
}
