package io.bibliotek.upload.exception;

public class MalformedKeyException extends UploadException {

    public MalformedKeyException(String key, String reason) {
        super("Malformed upload key '" + key + "': " + reason);
    }

    public MalformedKeyException(String key, String reason, Throwable cause) {
        super("Malformed upload key '" + key + "': " + reason, cause);
    }
}
