package io.bibliotek.upload.key;

/**
 * A decoded upload key.
 *
 * @param signature The file signature segment.
 * @param fileName The original (URL-decoded) file name.
 * @param value The full key as stored in the backend.
 */
public record ObjectKey(String signature, String fileName, String value) {
}
