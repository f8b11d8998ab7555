package io.bibliotek.upload.exception;

public class KeyTooLongException extends UploadException {

    public KeyTooLongException(int keyLengthBytes, int maxLengthBytes) {
        super("Object key is " + keyLengthBytes + " bytes long, the backend allows at most " + maxLengthBytes);
    }
}
