package io.bibliotek.web.dto;

public record CompleteUploadRequest(String key) {
}
