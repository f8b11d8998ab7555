package io.bibliotek.upload.exception;

/**
 * The backend dropped the session while the client was still using it, usually through its
 * own lifecycle expiry. Uploaded parts are gone; a new session has to be started at the same key.
 */
public class ExpiredSessionException extends UploadException {

    public ExpiredSessionException(String uploadId, Throwable cause) {
        super("Upload session " + uploadId + " no longer exists in the backend", cause);
    }
}
