package io.bibliotek.storage.api;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URL;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;

/**
 * The multipart-upload capabilities of an object store. Implementations keep no session
 * state of their own; everything they report comes from the backend.
 * <p>
 * Errors are signalled as {@link io.bibliotek.storage.api.exception.StorageException}s:
 * {@link io.bibliotek.storage.api.exception.UploadNotFoundException} when the backend no
 * longer knows the upload id, {@link io.bibliotek.storage.api.exception.StorageConnectivityException}
 * when the backend could not be reached.
 */
public interface ObjectStore {

    /**
     * Starts a new multipart upload.
     * @param key The key the completed object will be stored under.
     * @return A Mono containing the backend-assigned upload id.
     */
    Mono<String> createMultipartUpload(String key);

    /**
     * Lists the in-progress multipart uploads whose key starts with the given prefix.
     * All result pages are aggregated.
     * @param prefix The key prefix to scope the listing to.
     * @return A stream of the uploads, in backend order.
     */
    Flux<MultipartUploadInfo> listMultipartUploads(String prefix);

    /**
     * Lists the parts the backend holds for an upload. All result pages are aggregated.
     * @param key The key of the upload.
     * @param uploadId The upload id.
     * @return A stream of parts, in ascending part number order as reported by the backend.
     */
    Flux<PartInfo> listParts(String key, String uploadId);

    /**
     * Uploads (or replaces) a single part.
     * @param key The key of the upload.
     * @param uploadId The upload id.
     * @param partNumber The 1-based part number.
     * @param content The part bytes.
     * @return A Mono containing the eTag the backend assigned to the part.
     */
    Mono<String> uploadPart(String key, String uploadId, int partNumber, ByteBuffer content);

    /**
     * Assembles the listed parts into the final object.
     * @param key The key of the upload.
     * @param uploadId The upload id.
     * @param parts The completion manifest, sorted by part number.
     * @return A Mono containing the completed object.
     */
    Mono<CompletedObject> completeMultipartUpload(String key, String uploadId, List<CompletedPartRef> parts);

    /**
     * Discards an upload and every part uploaded for it.
     */
    Mono<Void> abortMultipartUpload(String key, String uploadId);

    /**
     * Checks whether a completed object exists under the key.
     */
    Mono<Boolean> objectExists(String key);

    /**
     * Creates a time-limited download URL for a completed object.
     */
    Mono<URL> presignDownload(String key, Duration validity);
}
