package io.bibliotek.web.dto;

import java.time.Instant;

public record DownloadUrlResponse(String url, Instant expiresAt) {
}
