package io.bibliotek.web.dto;

/**
 * What a client knows about a local file: its name, size in bytes and last-modified time in epoch millis.
 */
public record SignatureRequest(String name, long size, long lastModified) {
}
