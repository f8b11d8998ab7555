package io.bibliotek.storage.s3;

import io.bibliotek.storage.api.CompletedObject;
import io.bibliotek.storage.api.CompletedPartRef;
import io.bibliotek.storage.api.MultipartUploadInfo;
import io.bibliotek.storage.api.ObjectStore;
import io.bibliotek.storage.api.PartInfo;
import io.bibliotek.storage.api.exception.StorageConnectivityException;
import io.bibliotek.storage.api.exception.StorageException;
import io.bibliotek.storage.api.exception.UploadNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.*;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.net.URL;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

@Slf4j
@Component("s3ObjectStore")
public class S3ObjectStoreAdapter implements ObjectStore {
    private static final String NO_SUCH_UPLOAD = "NoSuchUpload";

    private final S3AsyncClient s3AsyncClient;
    private final S3Presigner s3Presigner;
    private final String bucketName;

    public S3ObjectStoreAdapter(S3AsyncClient s3AsyncClient,
                                S3Presigner s3Presigner,
                                @Value("${s3.bucket}") String bucketName) {
        this.s3AsyncClient = s3AsyncClient;
        this.s3Presigner = s3Presigner;
        this.bucketName = bucketName;
    }

    @Override
    public Mono<String> createMultipartUpload(String key) {
        CreateMultipartUploadRequest request = CreateMultipartUploadRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();

        return Mono.fromFuture(() -> s3AsyncClient.createMultipartUpload(request))
                .flatMap(response -> response.uploadId() == null || response.uploadId().isEmpty()
                        ? Mono.error(new StorageException("S3 returned no upload id for key: " + key))
                        : Mono.just(response.uploadId()))
                .doOnNext(uploadId -> log.debug("Created multipart upload {} for key {}", uploadId, key))
                .onErrorMap(translate("create multipart upload", key, null));
    }

    @Override
    public Flux<MultipartUploadInfo> listMultipartUploads(String prefix) {
        return fetchUploadsPage(prefix, null, null)
                .expand(page -> Boolean.TRUE.equals(page.isTruncated())
                        ? fetchUploadsPage(prefix, page.nextKeyMarker(), page.nextUploadIdMarker())
                        : Mono.empty())
                .flatMapIterable(ListMultipartUploadsResponse::uploads)
                // Entries without identity cannot be addressed later, so they are not reported.
                .filter(upload -> upload.key() != null && upload.uploadId() != null && !upload.uploadId().isEmpty())
                .map(upload -> new MultipartUploadInfo(upload.key(), upload.uploadId(), upload.initiated()))
                .onErrorMap(translate("list multipart uploads", prefix, null));
    }

    private Mono<ListMultipartUploadsResponse> fetchUploadsPage(String prefix, String keyMarker, String uploadIdMarker) {
        ListMultipartUploadsRequest request = ListMultipartUploadsRequest.builder()
                .bucket(bucketName)
                .prefix(prefix)
                .keyMarker(keyMarker)
                .uploadIdMarker(uploadIdMarker)
                .build();
        return Mono.fromFuture(() -> s3AsyncClient.listMultipartUploads(request));
    }

    @Override
    public Flux<PartInfo> listParts(String key, String uploadId) {
        return fetchPartsPage(key, uploadId, null)
                .expand(page -> Boolean.TRUE.equals(page.isTruncated())
                        ? fetchPartsPage(key, uploadId, page.nextPartNumberMarker())
                        : Mono.empty())
                .flatMapIterable(ListPartsResponse::parts)
                .map(part -> new PartInfo(
                        part.partNumber(),
                        part.eTag(),
                        part.size() == null ? 0L : part.size()))
                .onErrorMap(translate("list parts", key, uploadId));
    }

    private Mono<ListPartsResponse> fetchPartsPage(String key, String uploadId, Integer partNumberMarker) {
        ListPartsRequest request = ListPartsRequest.builder()
                .bucket(bucketName)
                .key(key)
                .uploadId(uploadId)
                .partNumberMarker(partNumberMarker)
                .build();
        return Mono.fromFuture(() -> s3AsyncClient.listParts(request));
    }

    @Override
    public Mono<String> uploadPart(String key, String uploadId, int partNumber, ByteBuffer content) {
        long size = content.remaining();
        log.debug("Uploading part {} of upload {} ({} bytes)", partNumber, uploadId, size);

        UploadPartRequest request = UploadPartRequest.builder()
                .bucket(bucketName)
                .key(key)
                .uploadId(uploadId)
                .partNumber(partNumber)
                .contentLength(size)
                .build();

        return Mono.fromFuture(() -> s3AsyncClient.uploadPart(request, AsyncRequestBody.fromByteBuffer(content)))
                .map(UploadPartResponse::eTag)
                .onErrorMap(translate("upload part " + partNumber, key, uploadId));
    }

    @Override
    public Mono<CompletedObject> completeMultipartUpload(String key, String uploadId, List<CompletedPartRef> parts) {
        List<CompletedPart> completedParts = parts.stream()
                .map(part -> CompletedPart.builder()
                        .partNumber(part.partNumber())
                        .eTag(part.eTag())
                        .build())
                .toList();

        CompleteMultipartUploadRequest request = CompleteMultipartUploadRequest.builder()
                .bucket(bucketName)
                .key(key)
                .uploadId(uploadId)
                .multipartUpload(CompletedMultipartUpload.builder().parts(completedParts).build())
                .build();

        log.info("Completing multipart upload {} with {} parts", uploadId, parts.size());

        return Mono.fromFuture(() -> s3AsyncClient.completeMultipartUpload(request))
                .map(response -> new CompletedObject(
                        response.key() == null ? key : response.key(),
                        response.eTag(),
                        response.location() == null ? objectUrl(key) : response.location()))
                .onErrorMap(translate("complete multipart upload", key, uploadId));
    }

    @Override
    public Mono<Void> abortMultipartUpload(String key, String uploadId) {
        AbortMultipartUploadRequest request = AbortMultipartUploadRequest.builder()
                .bucket(bucketName)
                .key(key)
                .uploadId(uploadId)
                .build();

        return Mono.fromFuture(() -> s3AsyncClient.abortMultipartUpload(request))
                .then()
                .onErrorMap(translate("abort multipart upload", key, uploadId));
    }

    @Override
    public Mono<Boolean> objectExists(String key) {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();

        return Mono.fromFuture(() -> s3AsyncClient.headObject(request))
                .map(response -> Boolean.TRUE)
                .onErrorResume(throwable -> isNotFound(unwrap(throwable)), throwable -> Mono.just(Boolean.FALSE))
                .onErrorMap(translate("head object", key, null));
    }

    @Override
    public Mono<URL> presignDownload(String key, Duration validity) {
        GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                .signatureDuration(validity)
                .getObjectRequest(builder -> builder.bucket(bucketName).key(key))
                .build();

        return Mono.fromCallable(() -> s3Presigner.presignGetObject(request).url())
                .onErrorMap(translate("presign download", key, null));
    }

    private String objectUrl(String key) {
        return s3AsyncClient.utilities()
                .getUrl(builder -> builder.bucket(bucketName).key(key))
                .toExternalForm();
    }

    private Function<Throwable, Throwable> translate(String operation, String key, String uploadId) {
        return throwable -> {
            // Mono.fromFuture may surface the SDK exception wrapped in a CompletionException.
            Throwable cause = unwrap(throwable);

            if (cause instanceof StorageException) {
                return cause;
            }
            if (uploadId != null && isNoSuchUpload(cause)) {
                return new UploadNotFoundException(uploadId,
                        "S3 has no multipart upload " + uploadId + " for key: " + key, cause);
            }
            if (cause instanceof SdkClientException) {
                return new StorageConnectivityException(
                        "Could not connect to S3 to " + operation + " for key: " + key, cause);
            }
            return new StorageException(
                    "S3 failed to " + operation + " for key: " + key + ": " + cause.getMessage(), cause);
        };
    }

    private static Throwable unwrap(Throwable throwable) {
        return (throwable instanceof CompletionException && throwable.getCause() != null)
                ? throwable.getCause()
                : throwable;
    }

    private static boolean isNoSuchUpload(Throwable cause) {
        if (cause instanceof NoSuchUploadException) {
            return true;
        }
        return cause instanceof S3Exception s3Exception
                && s3Exception.awsErrorDetails() != null
                && NO_SUCH_UPLOAD.equals(s3Exception.awsErrorDetails().errorCode());
    }

    private static boolean isNotFound(Throwable cause) {
        return cause instanceof NoSuchKeyException
                || (cause instanceof S3Exception s3Exception && s3Exception.statusCode() == 404);
    }
}
