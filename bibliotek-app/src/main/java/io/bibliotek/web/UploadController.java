package io.bibliotek.web;

import io.bibliotek.config.UploadProperties;
import io.bibliotek.upload.dto.CompletionResult;
import io.bibliotek.upload.dto.InitUploadResult;
import io.bibliotek.upload.dto.PendingUploadSummary;
import io.bibliotek.upload.dto.UploadedPart;
import io.bibliotek.upload.exception.CapacityExceededException;
import io.bibliotek.upload.service.ExpiryReaper;
import io.bibliotek.upload.service.UploadCoordinator;
import io.bibliotek.upload.signature.SignatureComputer;
import io.bibliotek.web.dto.CleanupResponse;
import io.bibliotek.web.dto.CompleteUploadRequest;
import io.bibliotek.web.dto.DownloadUrlResponse;
import io.bibliotek.web.dto.InitUploadRequest;
import io.bibliotek.web.dto.SignatureRequest;
import io.bibliotek.web.dto.SignatureResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.time.Clock;

@Slf4j
@RestController
@RequestMapping("/api/uploads")
public class UploadController {

    private final UploadCoordinator uploadCoordinator;
    private final ExpiryReaper expiryReaper;
    private final UploadProperties uploadProperties;
    private final Clock clock;

    public UploadController(UploadCoordinator uploadCoordinator,
                            ExpiryReaper expiryReaper,
                            UploadProperties uploadProperties,
                            Clock clock) {
        this.uploadCoordinator = uploadCoordinator;
        this.expiryReaper = expiryReaper;
        this.uploadProperties = uploadProperties;
        this.clock = clock;
    }

    /**
     * Computes the resume signature for clients that cannot hash locally.
     */
    @PostMapping("/signature")
    public Mono<SignatureResponse> signature(@RequestBody SignatureRequest request) {
        return Mono.fromCallable(() -> new SignatureResponse(
                SignatureComputer.compute(request.name(), request.size(), request.lastModified())));
    }

    @PostMapping("/init")
    public Mono<InitUploadResult> init(@RequestBody InitUploadRequest request) {
        return uploadCoordinator.initOrResume(request.signature(), request.fileName(), request.fileSize());
    }

    /**
     * Stores one chunk. The whole body is buffered, bounded by {@code upload.max-request-chunk-size},
     * because the backend needs the part length up front.
     */
    @PutMapping(value = "/{uploadId}/parts/{partNumber}", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public Mono<UploadedPart> uploadPart(@PathVariable String uploadId,
                                         @PathVariable int partNumber,
                                         @RequestParam String key,
                                         ServerHttpRequest request) {
        int maxBytes = (int) Math.min(uploadProperties.getMaxRequestChunkSize(), Integer.MAX_VALUE);

        return readBody(request.getBody(), maxBytes)
                .onErrorMap(DataBufferLimitException.class, e -> new CapacityExceededException(
                        "Part " + partNumber + " exceeds the request limit of " + maxBytes + " bytes"))
                .flatMap(content -> uploadCoordinator.uploadPart(uploadId, key, partNumber, content));
    }

    @PostMapping("/{uploadId}/complete")
    public Mono<CompletionResult> complete(@PathVariable String uploadId,
                                           @RequestBody CompleteUploadRequest request) {
        return uploadCoordinator.complete(uploadId, request.key());
    }

    @DeleteMapping("/{uploadId}")
    public Mono<ResponseEntity<Void>> abort(@PathVariable String uploadId, @RequestParam String key) {
        return uploadCoordinator.abort(uploadId, key)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @GetMapping("/pending")
    public Flux<PendingUploadSummary> pending() {
        return uploadCoordinator.listPending();
    }

    @GetMapping("/{uploadId}")
    public Mono<PendingUploadSummary> status(@PathVariable String uploadId) {
        return uploadCoordinator.status(uploadId);
    }

    /**
     * Aborts sessions older than {@code maxAgeHours}, falling back to the reaper's configured age.
     */
    @PostMapping("/cleanup")
    public Mono<CleanupResponse> cleanup(@RequestParam(required = false) Long maxAgeHours) {
        long hours = maxAgeHours != null ? maxAgeHours : uploadProperties.getReaperMaxAgeHours();
        log.info("Manual cleanup of uploads older than {}h requested", hours);
        return expiryReaper.sweep(hours).map(CleanupResponse::new);
    }

    @GetMapping("/download-url")
    public Mono<DownloadUrlResponse> downloadUrl(@RequestParam String key) {
        return uploadCoordinator.downloadUrl(key, uploadProperties.getDownloadUrlTtl())
                .map(url -> new DownloadUrlResponse(url.toExternalForm(),
                        clock.instant().plus(uploadProperties.getDownloadUrlTtl())));
    }

    private static Mono<ByteBuffer> readBody(Flux<DataBuffer> body, int maxBytes) {
        return DataBufferUtils.join(body, maxBytes)
                .map(joined -> {
                    try {
                        byte[] bytes = new byte[joined.readableByteCount()];
                        joined.read(bytes);
                        return ByteBuffer.wrap(bytes);
                    } finally {
                        DataBufferUtils.release(joined);
                    }
                })
                .defaultIfEmpty(ByteBuffer.allocate(0));
    }
}
