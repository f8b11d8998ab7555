package io.bibliotek.web;

import io.bibliotek.storage.api.exception.StorageConnectivityException;
import io.bibliotek.storage.api.exception.StorageException;
import io.bibliotek.upload.exception.AbortFailedException;
import io.bibliotek.upload.exception.CapacityExceededException;
import io.bibliotek.upload.exception.CompletionFailedException;
import io.bibliotek.upload.exception.ExpiredSessionException;
import io.bibliotek.upload.exception.KeyTooLongException;
import io.bibliotek.upload.exception.MalformedKeyException;
import io.bibliotek.upload.exception.PartUploadFailedException;
import io.bibliotek.upload.exception.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;
import java.util.Map;

/**
 * Maps upload and storage failures to HTTP responses with a body of
 * {@code {error, message, timestamp}}.
 */
@Slf4j
@RestControllerAdvice
public class UploadExceptionHandler {

    private final Clock clock;

    public UploadExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler({IllegalArgumentException.class, KeyTooLongException.class, MalformedKeyException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        log.debug("Rejected upload request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableInput(ServerWebInputException ex) {
        log.debug("Unreadable upload request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getReason());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSessionNotFound(SessionNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "session_not_found", ex.getMessage());
    }

    @ExceptionHandler(ExpiredSessionException.class)
    public ResponseEntity<Map<String, Object>> handleExpiredSession(ExpiredSessionException ex) {
        log.info("Part sent to expired session: {}", ex.getMessage());
        return error(HttpStatus.GONE, "session_expired", ex.getMessage());
    }

    @ExceptionHandler(CompletionFailedException.class)
    public ResponseEntity<Map<String, Object>> handleCompletionFailed(CompletionFailedException ex) {
        log.warn("Completion failed: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "completion_failed", ex.getMessage());
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<Map<String, Object>> handleCapacityExceeded(CapacityExceededException ex) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "capacity_exceeded", ex.getMessage());
    }

    @ExceptionHandler({PartUploadFailedException.class, AbortFailedException.class})
    public ResponseEntity<Map<String, Object>> handleBackendOperationFailed(RuntimeException ex) {
        log.error("Storage operation failed: {}", ex.getMessage(), ex.getCause());
        return error(HttpStatus.BAD_GATEWAY, "storage_error", ex.getMessage());
    }

    @ExceptionHandler(StorageConnectivityException.class)
    public ResponseEntity<Map<String, Object>> handleStorageUnavailable(StorageConnectivityException ex) {
        log.error("Storage unreachable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "storage_unavailable", "Storage backend is unavailable");
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex) {
        log.error("Storage error: {}", ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, "storage_error", ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", error,
                        "message", message == null ? status.getReasonPhrase() : message,
                        "timestamp", clock.instant().toString()
                ));
    }
}
