package io.bibliotek.upload.exception;

public class CapacityExceededException extends UploadException {

    public CapacityExceededException(String message) {
        super(message);
    }
}
