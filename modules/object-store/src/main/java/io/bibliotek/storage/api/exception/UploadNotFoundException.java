package io.bibliotek.storage.api.exception;

/**
 * The backend does not know the upload id: it was completed, aborted or expired.
 */
public class UploadNotFoundException extends StorageException {

    private final String uploadId;

    public UploadNotFoundException(String uploadId, String message, Throwable cause) {
        super(message, cause);
        this.uploadId = uploadId;
    }

    public String getUploadId() {
        return uploadId;
    }
}
