package io.bibliotek.upload.dto;

import java.util.List;

public record InitUploadResult(
        String uploadId,
        String key,
        long chunkSize,
        long totalChunks,
        int completedChunks,
        List<Integer> completedPartNumbers, // ascending; lets clients fill gaps left by out-of-order uploads
        boolean resumed
) {}
