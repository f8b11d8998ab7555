package io.bibliotek.storage.api;

import java.time.Instant;

public record MultipartUploadInfo(
        String key,
        String uploadId,
        Instant initiatedAt
) {}
