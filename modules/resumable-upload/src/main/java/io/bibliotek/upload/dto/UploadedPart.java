package io.bibliotek.upload.dto;

public record UploadedPart(
        int partNumber,
        String eTag,
        long size
) {}
