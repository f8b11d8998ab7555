package io.bibliotek.storage.api;

public record CompletedObject(
        String key,
        String eTag,
        String location // URL of the assembled object, as reported by the backend
) {}
