package io.bibliotek.upload.dto;

/**
 * Outcome of completing an upload.
 *
 * @param key The key of the final object.
 * @param signature The signature segment of the key.
 * @param fileName The decoded file name, for hand-off to cataloging.
 * @param location The backend URL of the final object, null when {@code alreadyCompleted}.
 * @param partCount Number of parts assembled, 0 when {@code alreadyCompleted}.
 * @param alreadyCompleted True when the backend no longer knows the session but an object exists
 *                         at the key. Usually an earlier call completed it; the object may also
 *                         stem from an older upload of the same file while this session was
 *                         aborted or reaped. Either way it is a terminal success, not an error.
 */
public record CompletionResult(
        String key,
        String signature,
        String fileName,
        String location,
        int partCount,
        boolean alreadyCompleted
) {}
