package io.bibliotek.storage.api;

/**
 * One entry of a completion manifest.
 */
public record CompletedPartRef(int partNumber, String eTag) {}
