package io.bibliotek.web.dto;

public record InitUploadRequest(String signature, String fileName, long fileSize) {
}
