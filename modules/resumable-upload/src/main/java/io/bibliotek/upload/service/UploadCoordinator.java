package io.bibliotek.upload.service;

import io.bibliotek.storage.api.CompletedPartRef;
import io.bibliotek.storage.api.MultipartUploadInfo;
import io.bibliotek.storage.api.ObjectStore;
import io.bibliotek.storage.api.PartInfo;
import io.bibliotek.storage.api.exception.UploadNotFoundException;
import io.bibliotek.upload.config.UploadLimits;
import io.bibliotek.upload.dto.CompletionResult;
import io.bibliotek.upload.dto.InitUploadResult;
import io.bibliotek.upload.dto.PendingUploadSummary;
import io.bibliotek.upload.dto.UploadedPart;
import io.bibliotek.upload.exception.AbortFailedException;
import io.bibliotek.upload.exception.CapacityExceededException;
import io.bibliotek.upload.exception.CompletionFailedException;
import io.bibliotek.upload.exception.ExpiredSessionException;
import io.bibliotek.upload.exception.PartUploadFailedException;
import io.bibliotek.upload.exception.SessionNotFoundException;
import io.bibliotek.upload.key.KeyCodec;
import io.bibliotek.upload.key.ObjectKey;
import io.bibliotek.upload.signature.SignatureComputer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URL;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orchestrates resumable multipart uploads on top of an {@link ObjectStore}.
 * <p>
 * The coordinator keeps no session state. Every answer it gives is derived from the
 * backend's own listings of in-progress uploads and their parts, so a restarted process
 * resumes exactly where the backend says the upload stands. Concurrent calls are safe;
 * two clients initialising the same signature at the same moment may each get their own
 * session, and whichever completes last owns the object at the key.
 */
@Slf4j
@Service
public class UploadCoordinator {
    private static final int SUMMARY_CONCURRENCY = 8;
    private static final int MAX_REPORTED_GAPS = 20;

    private static final Comparator<PartInfo> BY_PART_NUMBER = Comparator.comparingInt(PartInfo::partNumber);

    private final ObjectStore objectStore;
    private final UploadLimits limits;

    public UploadCoordinator(ObjectStore objectStore, UploadLimits limits) {
        this.objectStore = objectStore;
        this.limits = limits;
    }

    /**
     * Resumes the upload in progress for the signature, or starts a new one.
     *
     * @param signature The client-computed file signature.
     * @param fileName The original file name.
     * @param fileSize The file size in bytes, as the client sees it now.
     * @return A Mono with the session the client should upload into.
     */
    public Mono<InitUploadResult> initOrResume(String signature, String fileName, long fileSize) {
        return Mono.defer(() -> {
            if (!SignatureComputer.isValid(signature)) {
                throw new IllegalArgumentException("Signature must be " + SignatureComputer.SIGNATURE_LENGTH
                        + " lowercase hex characters");
            }
            requireText(fileName, "fileName");
            if (fileSize <= 0) {
                throw new IllegalArgumentException("fileSize must be positive, got " + fileSize);
            }

            String key = KeyCodec.encode(signature, fileName);
            checkCapacity(fileSize, limits.defaultChunkSize());

            return findSession(signature, key)
                    .flatMap(upload -> resume(upload, fileSize)
                            .onErrorResume(UploadNotFoundException.class, e -> {
                                // Finished or reaped between the two listings
                                log.warn("Upload {} vanished while resuming, starting a new session", upload.uploadId());
                                return startNew(key, fileSize);
                            }))
                    .switchIfEmpty(Mono.defer(() -> startNew(key, fileSize)));
        });
    }

    /**
     * Stores one chunk. Part numbers may arrive in any order and may be re-sent; the
     * backend keeps the latest bytes for each number.
     */
    public Mono<UploadedPart> uploadPart(String uploadId, String key, int partNumber, ByteBuffer content) {
        return Mono.defer(() -> {
            requireText(uploadId, "uploadId");
            KeyCodec.decode(key);
            if (partNumber < 1 || partNumber > UploadLimits.MAX_PART_COUNT) {
                throw new IllegalArgumentException("partNumber must be between 1 and "
                        + UploadLimits.MAX_PART_COUNT + ", got " + partNumber);
            }
            long size = content.remaining();
            if (size == 0) {
                throw new IllegalArgumentException("Part " + partNumber + " is empty");
            }
            if (size > UploadLimits.MAX_PART_SIZE) {
                throw new CapacityExceededException("Part " + partNumber + " is " + size
                        + " bytes, the backend accepts at most " + UploadLimits.MAX_PART_SIZE);
            }

            return objectStore.uploadPart(key, uploadId, partNumber, content)
                    .map(eTag -> new UploadedPart(partNumber, eTag, size))
                    .doOnNext(part -> log.debug("Stored part {} of upload {} ({} bytes)", partNumber, uploadId, size))
                    .onErrorMap(error -> error instanceof UploadNotFoundException
                            ? new ExpiredSessionException(uploadId, error)
                            : new PartUploadFailedException(uploadId, partNumber, error));
        });
    }

    /**
     * Assembles the uploaded parts into the final object. On failure the session stays
     * open and the call can be repeated. When the session is gone, an object at the key is
     * reported as {@code alreadyCompleted}; which session produced that object is not checked.
     */
    public Mono<CompletionResult> complete(String uploadId, String key) {
        return Mono.defer(() -> {
            requireText(uploadId, "uploadId");
            ObjectKey objectKey = KeyCodec.decode(key);

            return objectStore.listParts(key, uploadId)
                    .collectSortedList(BY_PART_NUMBER)
                    .flatMap(parts -> {
                        List<CompletedPartRef> manifest = buildManifest(uploadId, parts);
                        return objectStore.completeMultipartUpload(key, uploadId, manifest)
                                .map(completed -> new CompletionResult(completed.key(), objectKey.signature(),
                                        objectKey.fileName(), completed.location(), manifest.size(), false))
                                .onErrorMap(error -> !(error instanceof UploadNotFoundException),
                                        error -> new CompletionFailedException("Backend rejected completion of upload "
                                                + uploadId + ": " + error.getMessage(), error));
                    })
                    .onErrorResume(UploadNotFoundException.class, e -> alreadyCompletedOrMissing(uploadId, objectKey, e))
                    .doOnNext(result -> log.info("Upload {} for '{}' {}", uploadId, result.fileName(),
                            result.alreadyCompleted() ? "was already completed" : "completed with " + result.partCount() + " parts"));
        });
    }

    public Mono<Void> abort(String uploadId, String key) {
        return Mono.defer(() -> {
            requireText(uploadId, "uploadId");
            KeyCodec.decode(key);

            return objectStore.abortMultipartUpload(key, uploadId)
                    .doOnSuccess(ignored -> log.info("Aborted upload {} for key {}", uploadId, key))
                    .onErrorMap(error -> error instanceof UploadNotFoundException
                            ? new SessionNotFoundException(uploadId, error)
                            : new AbortFailedException(uploadId, error));
        });
    }

    /**
     * All sessions currently open in the backend, most recently started first.
     */
    public Flux<PendingUploadSummary> listPending() {
        return objectStore.listMultipartUploads(KeyCodec.ROOT_PREFIX)
                .flatMap(this::summarize, SUMMARY_CONCURRENCY)
                .sort(Comparator.comparing(PendingUploadSummary::createdAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
    }

    public Mono<PendingUploadSummary> status(String uploadId) {
        return Mono.defer(() -> {
            requireText(uploadId, "uploadId");

            return objectStore.listMultipartUploads(KeyCodec.ROOT_PREFIX)
                    .filter(upload -> upload.uploadId().equals(uploadId))
                    .next()
                    .switchIfEmpty(Mono.error(() -> new SessionNotFoundException(uploadId)))
                    .flatMap(upload -> {
                        ObjectKey objectKey = KeyCodec.tryDecode(upload.key())
                                .orElseThrow(() -> new SessionNotFoundException(uploadId));
                        return objectStore.listParts(upload.key(), uploadId)
                                .collectSortedList(BY_PART_NUMBER)
                                .map(parts -> toSummary(upload, objectKey, parts));
                    })
                    .onErrorMap(UploadNotFoundException.class, e -> new SessionNotFoundException(uploadId, e));
        });
    }

    /**
     * A time-limited link to a completed object.
     */
    public Mono<URL> downloadUrl(String key, Duration validity) {
        return Mono.defer(() -> {
            KeyCodec.decode(key);
            return objectStore.presignDownload(key, validity);
        });
    }

    private Mono<MultipartUploadInfo> findSession(String signature, String key) {
        // Prefer a session at this exact key, then the most recently started one
        Comparator<MultipartUploadInfo> preference = Comparator
                .comparing((MultipartUploadInfo upload) -> !upload.key().equals(key))
                .thenComparing(MultipartUploadInfo::initiatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

        return objectStore.listMultipartUploads(KeyCodec.signaturePrefix(signature))
                .filter(upload -> KeyCodec.tryDecode(upload.key()).isPresent())
                .sort(preference)
                .next();
    }

    private Mono<InitUploadResult> resume(MultipartUploadInfo upload, long fileSize) {
        return objectStore.listParts(upload.key(), upload.uploadId())
                .collectSortedList(BY_PART_NUMBER)
                .map(parts -> {
                    long chunkSize = chunkSizeOf(parts);
                    if (chunkSize * UploadLimits.MAX_PART_COUNT < fileSize) {
                        // Part 1 is shorter than a full chunk, so it cannot be the session's chunk size
                        log.warn("Part 1 of upload {} is only {} bytes, using the default chunk size",
                                upload.uploadId(), chunkSize);
                        chunkSize = limits.defaultChunkSize();
                    }

                    List<Integer> partNumbers = parts.stream().map(PartInfo::partNumber).toList();
                    long totalChunks = totalChunks(fileSize, chunkSize);
                    log.info("Resuming upload {} for key {}: {}/{} chunks present",
                            upload.uploadId(), upload.key(), parts.size(), totalChunks);

                    return new InitUploadResult(upload.uploadId(), upload.key(), chunkSize, totalChunks,
                            parts.size(), partNumbers, true);
                });
    }

    private Mono<InitUploadResult> startNew(String key, long fileSize) {
        long chunkSize = limits.defaultChunkSize();
        long totalChunks = totalChunks(fileSize, chunkSize);

        return objectStore.createMultipartUpload(key)
                .doOnNext(uploadId -> log.info("Created upload {} for key {} ({} chunks of {} bytes)",
                        uploadId, key, totalChunks, chunkSize))
                .map(uploadId -> new InitUploadResult(uploadId, key, chunkSize, totalChunks, 0, List.of(), false));
    }

    private Mono<PendingUploadSummary> summarize(MultipartUploadInfo upload) {
        ObjectKey objectKey = KeyCodec.tryDecode(upload.key()).orElse(null);
        if (objectKey == null) {
            log.warn("Skipping upload {} with foreign key {}", upload.uploadId(), upload.key());
            return Mono.empty();
        }

        return objectStore.listParts(upload.key(), upload.uploadId())
                .collectSortedList(BY_PART_NUMBER)
                .map(parts -> toSummary(upload, objectKey, parts))
                .onErrorResume(UploadNotFoundException.class, e -> {
                    log.debug("Upload {} finished while it was being listed", upload.uploadId());
                    return Mono.empty();
                })
                .onErrorResume(error -> {
                    log.warn("Failed to list parts for upload {}: {}", upload.uploadId(), error.getMessage());
                    return Mono.just(toSummary(upload, objectKey, List.of()));
                });
    }

    private PendingUploadSummary toSummary(MultipartUploadInfo upload, ObjectKey objectKey, List<PartInfo> parts) {
        long bytesUploaded = parts.stream().mapToLong(PartInfo::size).sum();
        return new PendingUploadSummary(
                upload.uploadId(),
                upload.key(),
                objectKey.signature(),
                objectKey.fileName(),
                chunkSizeOf(parts),
                parts.size(),
                bytesUploaded,
                upload.initiatedAt()
        );
    }

    private Mono<CompletionResult> alreadyCompletedOrMissing(String uploadId, ObjectKey objectKey, Throwable cause) {
        return objectStore.objectExists(objectKey.value())
                .flatMap(exists -> {
                    if (!exists) {
                        return Mono.error(new SessionNotFoundException(uploadId, cause));
                    }
                    return Mono.just(new CompletionResult(objectKey.value(), objectKey.signature(),
                            objectKey.fileName(), null, 0, true));
                });
    }

    private List<CompletedPartRef> buildManifest(String uploadId, List<PartInfo> sortedParts) {
        if (sortedParts.isEmpty()) {
            throw new CompletionFailedException("Upload " + uploadId + " has no parts to complete");
        }

        List<Integer> missing = new ArrayList<>();
        int expected = 1;
        for (PartInfo part : sortedParts) {
            while (expected < part.partNumber() && missing.size() < MAX_REPORTED_GAPS) {
                missing.add(expected++);
            }
            expected = part.partNumber() + 1;
        }
        if (!missing.isEmpty()) {
            throw new CompletionFailedException("Upload " + uploadId + " is missing parts " + missing
                    + (missing.size() == MAX_REPORTED_GAPS ? " (and possibly more)" : ""));
        }

        return sortedParts.stream().map(PartInfo::toCompletedPartRef).toList();
    }

    /**
     * The size of part 1 when it is present, otherwise the configured default. Parts may
     * arrive in any order, so the lowest part present says nothing about the chunk size.
     */
    private long chunkSizeOf(List<PartInfo> sortedParts) {
        return sortedParts.stream()
                .filter(part -> part.partNumber() == 1 && part.size() > 0)
                .findFirst()
                .map(PartInfo::size)
                .orElse(limits.defaultChunkSize());
    }

    private static long totalChunks(long fileSize, long chunkSize) {
        return (fileSize + chunkSize - 1) / chunkSize;
    }

    private static void checkCapacity(long fileSize, long chunkSize) {
        if (fileSize > UploadLimits.MAX_OBJECT_SIZE) {
            throw new CapacityExceededException("File size " + fileSize + " exceeds the maximum object size of "
                    + UploadLimits.MAX_OBJECT_SIZE + " bytes");
        }
        if (chunkSize * UploadLimits.MAX_PART_COUNT < fileSize) {
            throw new CapacityExceededException("File size " + fileSize + " needs more than "
                    + UploadLimits.MAX_PART_COUNT + " parts of " + chunkSize + " bytes");
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
