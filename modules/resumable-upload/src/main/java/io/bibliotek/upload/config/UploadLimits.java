package io.bibliotek.upload.config;

/**
 * Numeric limits of the multipart backend, plus the chunk size handed to clients when a
 * session has no parts yet.
 */
public record UploadLimits(long defaultChunkSize) {

    public static final long MIN_PART_SIZE = 5L * 1024 * 1024;            // 5 MiB, all parts but the last
    public static final long MAX_PART_SIZE = 5L * 1024 * 1024 * 1024;     // 5 GiB
    public static final int MAX_PART_COUNT = 10_000;
    public static final long MAX_OBJECT_SIZE = 5L * 1024 * 1024 * 1024 * 1024; // 5 TiB
    public static final int MAX_KEY_LENGTH_BYTES = 1024;

    public UploadLimits {
        if (defaultChunkSize < MIN_PART_SIZE || defaultChunkSize > MAX_PART_SIZE) {
            throw new IllegalArgumentException("Default chunk size must be between "
                    + MIN_PART_SIZE + " and " + MAX_PART_SIZE + " bytes, got " + defaultChunkSize);
        }
    }

    public static UploadLimits defaults() {
        return new UploadLimits(MIN_PART_SIZE);
    }

    public long maxFileSizeFor(long chunkSize) {
        return Math.min(chunkSize * MAX_PART_COUNT, MAX_OBJECT_SIZE);
    }
}
