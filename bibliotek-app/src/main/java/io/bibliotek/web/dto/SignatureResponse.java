package io.bibliotek.web.dto;

public record SignatureResponse(String signature) {
}
