package io.bibliotek.storage.api;

public record PartInfo(
        int partNumber,
        String eTag,
        long size
) {

    public CompletedPartRef toCompletedPartRef() {
        return new CompletedPartRef(partNumber, eTag);
    }
}
