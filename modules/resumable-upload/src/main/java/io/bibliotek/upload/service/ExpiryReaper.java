package io.bibliotek.upload.service;

import io.bibliotek.storage.api.MultipartUploadInfo;
import io.bibliotek.storage.api.ObjectStore;
import io.bibliotek.upload.key.KeyCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Aborts upload sessions that have been open for longer than a given age. Sessions are
 * judged by the creation time the backend reports, so the sweep needs no bookkeeping of its own.
 */
@Slf4j
@Service
public class ExpiryReaper {

    private final ObjectStore objectStore;
    private final UploadCoordinator uploadCoordinator;
    private final Clock clock;

    public ExpiryReaper(ObjectStore objectStore, UploadCoordinator uploadCoordinator, Clock clock) {
        this.objectStore = objectStore;
        this.uploadCoordinator = uploadCoordinator;
        this.clock = clock;
    }

    /**
     * Aborts every session started more than {@code maxAgeHours} ago. A session that cannot
     * be aborted is logged and skipped.
     *
     * @param maxAgeHours The age in hours after which a session counts as abandoned.
     * @return A Mono containing the number of sessions actually aborted.
     */
    public Mono<Integer> sweep(long maxAgeHours) {
        return Mono.defer(() -> {
            if (maxAgeHours < 0) {
                throw new IllegalArgumentException("maxAgeHours must not be negative, got " + maxAgeHours);
            }
            Instant cutoff = clock.instant().minus(Duration.ofHours(maxAgeHours));

            return objectStore.listMultipartUploads(KeyCodec.ROOT_PREFIX)
                    .filter(upload -> KeyCodec.tryDecode(upload.key()).isPresent())
                    .filter(upload -> upload.initiatedAt() != null && upload.initiatedAt().isBefore(cutoff))
                    .concatMap(this::abortQuietly)
                    .reduce(0, Integer::sum)
                    .doOnNext(count -> {
                        if (count > 0) {
                            log.info("Cleaned up {} upload sessions older than {}h", count, maxAgeHours);
                        }
                    });
        });
    }

    private Mono<Integer> abortQuietly(MultipartUploadInfo upload) {
        return uploadCoordinator.abort(upload.uploadId(), upload.key())
                .thenReturn(1)
                .onErrorResume(error -> {
                    log.warn("Failed to abort expired upload {} (key {}): {}",
                            upload.uploadId(), upload.key(), error.getMessage());
                    return Mono.just(0);
                });
    }
}
