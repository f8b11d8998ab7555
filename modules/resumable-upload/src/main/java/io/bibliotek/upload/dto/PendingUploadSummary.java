package io.bibliotek.upload.dto;

import java.time.Instant;

public record PendingUploadSummary(
        String uploadId,
        String key,
        String signature,
        String fileName,
        long chunkSize,
        int completedChunks,
        long bytesUploaded,
        Instant createdAt
) {}
