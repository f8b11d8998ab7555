package io.bibliotek.upload.support;

import io.bibliotek.storage.api.CompletedObject;
import io.bibliotek.storage.api.CompletedPartRef;
import io.bibliotek.storage.api.MultipartUploadInfo;
import io.bibliotek.storage.api.ObjectStore;
import io.bibliotek.storage.api.PartInfo;
import io.bibliotek.storage.api.exception.StorageException;
import io.bibliotek.storage.api.exception.UploadNotFoundException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * An {@link ObjectStore} that keeps multipart sessions in memory and follows the S3 rules the
 * coordinator relies on: re-sent parts replace earlier ones, completed or aborted sessions are
 * gone, and unknown upload ids fail with {@link UploadNotFoundException}.
 */
public class InMemoryObjectStore implements ObjectStore {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final Set<String> failingAborts = ConcurrentHashMap.newKeySet();
    private Clock clock;

    public InMemoryObjectStore() {
        this(Clock.systemUTC());
    }

    public InMemoryObjectStore(Clock clock) {
        this.clock = clock;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    public void failAbortOf(String uploadId) {
        failingAborts.add(uploadId);
    }

    public boolean hasObject(String key) {
        return objects.containsKey(key);
    }

    public byte[] objectContent(String key) {
        return objects.get(key);
    }

    public int sessionCount() {
        return sessions.size();
    }

    @Override
    public Mono<String> createMultipartUpload(String key) {
        return Mono.fromSupplier(() -> {
            String uploadId = UUID.randomUUID().toString();
            sessions.put(uploadId, new Session(key, uploadId, clock.instant()));
            return uploadId;
        });
    }

    @Override
    public Flux<MultipartUploadInfo> listMultipartUploads(String prefix) {
        return Flux.defer(() -> Flux.fromIterable(sessions.values().stream()
                .filter(session -> session.key.startsWith(prefix))
                .sorted(Comparator.comparing((Session session) -> session.key)
                        .thenComparing(session -> session.initiatedAt))
                .map(session -> new MultipartUploadInfo(session.key, session.uploadId, session.initiatedAt))
                .toList()));
    }

    @Override
    public Flux<PartInfo> listParts(String key, String uploadId) {
        return Flux.defer(() -> {
            Session session = find(key, uploadId);
            return Flux.fromIterable(session.parts.entrySet().stream()
                    .map(entry -> new PartInfo(entry.getKey(), eTag(entry.getValue()), entry.getValue().length))
                    .toList());
        });
    }

    @Override
    public Mono<String> uploadPart(String key, String uploadId, int partNumber, ByteBuffer content) {
        return Mono.fromCallable(() -> {
            Session session = find(key, uploadId);
            byte[] bytes = new byte[content.remaining()];
            content.get(bytes);
            session.parts.put(partNumber, bytes);
            return eTag(bytes);
        });
    }

    @Override
    public Mono<CompletedObject> completeMultipartUpload(String key, String uploadId, List<CompletedPartRef> parts) {
        return Mono.fromCallable(() -> {
            Session session = find(key, uploadId);
            int size = 0;
            for (CompletedPartRef ref : parts) {
                byte[] bytes = session.parts.get(ref.partNumber());
                if (bytes == null || !eTag(bytes).equals(ref.eTag())) {
                    throw new StorageException("InvalidPart: part " + ref.partNumber() + " of upload " + uploadId);
                }
                size += bytes.length;
            }
            byte[] object = new byte[size];
            int offset = 0;
            for (CompletedPartRef ref : parts) {
                byte[] bytes = session.parts.get(ref.partNumber());
                System.arraycopy(bytes, 0, object, offset, bytes.length);
                offset += bytes.length;
            }
            sessions.remove(uploadId);
            objects.put(key, object);
            return new CompletedObject(key, "\"" + uploadId + "-" + parts.size() + "\"", "memory://bucket/" + key);
        });
    }

    @Override
    public Mono<Void> abortMultipartUpload(String key, String uploadId) {
        return Mono.fromRunnable(() -> {
            if (failingAborts.contains(uploadId)) {
                throw new StorageException("Abort of " + uploadId + " refused");
            }
            find(key, uploadId);
            sessions.remove(uploadId);
        });
    }

    @Override
    public Mono<Boolean> objectExists(String key) {
        return Mono.fromSupplier(() -> objects.containsKey(key));
    }

    @Override
    public Mono<URL> presignDownload(String key, Duration validity) {
        return Mono.fromCallable(() -> {
            try {
                return new URL("http://memory.local/bucket/" + key + "?expires=" + validity.toSeconds());
            } catch (MalformedURLException e) {
                throw new StorageException("Cannot build URL for " + key, e);
            }
        });
    }

    private Session find(String key, String uploadId) {
        Session session = sessions.get(uploadId);
        if (session == null || !session.key.equals(key)) {
            throw new UploadNotFoundException(uploadId, "No multipart upload " + uploadId + " for key: " + key, null);
        }
        return session;
    }

    private static String eTag(byte[] bytes) {
        return "\"" + Integer.toHexString(Arrays.hashCode(bytes)) + "-" + bytes.length + "\"";
    }

    private static final class Session {
        private final String key;
        private final String uploadId;
        private final Instant initiatedAt;
        private final Map<Integer, byte[]> parts = new ConcurrentSkipListMap<>();

        private Session(String key, String uploadId, Instant initiatedAt) {
            this.key = key;
            this.uploadId = uploadId;
            this.initiatedAt = initiatedAt;
        }
    }
}
