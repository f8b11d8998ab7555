package io.bibliotek.web.dto;

public record CleanupResponse(int aborted) {
}
