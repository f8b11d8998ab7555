package io.bibliotek.upload.exception;

/**
 * The backend has no session for the given identifier. The caller has to start over with
 * a new init call.
 */
public class SessionNotFoundException extends UploadException {

    public SessionNotFoundException(String uploadId) {
        super("No upload session found for upload id: " + uploadId);
    }

    public SessionNotFoundException(String uploadId, Throwable cause) {
        super("No upload session found for upload id: " + uploadId, cause);
    }
}
