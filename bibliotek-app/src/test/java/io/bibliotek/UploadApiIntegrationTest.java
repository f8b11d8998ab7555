package io.bibliotek;

import com.adobe.testing.s3mock.testcontainers.S3MockContainer;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs a complete upload through the HTTP API against S3Mock.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class UploadApiIntegrationTest {
    private static final String BUCKET = "test-bucket";

    @Container
    private static final S3MockContainer s3mock = new S3MockContainer(DockerImageName.parse("adobe/s3mock:3.11.0"))
            .withInitialBuckets(BUCKET);

    @DynamicPropertySource
    private static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("s3.endpoint", s3mock::getHttpEndpoint);
        registry.add("s3.bucket", () -> BUCKET);
    }

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void singleChunkUpload_shouldBeResumableCompletableAndDownloadable() {
        byte[] content = "hello bibliotek".getBytes(StandardCharsets.UTF_8);

        String signature = webTestClient.post().uri("/api/uploads/signature")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "hello world.txt", "size", content.length, "lastModified", 1L))
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult().getResponseBody()
                .get("signature").asText();

        JsonNode init = initUpload(signature, content.length);
        String uploadId = init.get("uploadId").asText();
        String key = init.get("key").asText();
        assertThat(key).isEqualTo("uploads/" + signature + "/hello%20world.txt");
        assertThat(init.get("resumed").asBoolean()).isFalse();
        assertThat(init.get("totalChunks").asLong()).isEqualTo(1);

        webTestClient.put().uri(builder -> builder.path("/api/uploads/{uploadId}/parts/1").queryParam("key", key).build(uploadId))
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(content)
                .exchange()
                .expectStatus().isOk();

        JsonNode resumed = initUpload(signature, content.length);
        assertThat(resumed.get("uploadId").asText()).isEqualTo(uploadId);
        assertThat(resumed.get("resumed").asBoolean()).isTrue();
        assertThat(resumed.get("completedChunks").asInt()).isEqualTo(1);

        webTestClient.get().uri("/api/uploads/pending")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[?(@.uploadId == '" + uploadId + "')].fileName").isEqualTo("hello world.txt");

        webTestClient.post().uri("/api/uploads/{uploadId}/complete", uploadId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("key", key))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.key").isEqualTo(key)
                .jsonPath("$.partCount").isEqualTo(1)
                .jsonPath("$.alreadyCompleted").isEqualTo(false);

        webTestClient.get().uri(builder -> builder.path("/api/uploads/download-url").queryParam("key", key).build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.url").exists();
    }

    @Test
    void abortedUpload_shouldNoLongerBeReported() {
        JsonNode init = initUpload("fedcba9876543210", 10);
        String uploadId = init.get("uploadId").asText();
        String key = init.get("key").asText();

        webTestClient.delete().uri(builder -> builder.path("/api/uploads/{uploadId}").queryParam("key", key).build(uploadId))
                .exchange()
                .expectStatus().isNoContent();

        webTestClient.get().uri("/api/uploads/{uploadId}", uploadId)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("session_not_found");
    }

    private JsonNode initUpload(String signature, long fileSize) {
        return webTestClient.post().uri("/api/uploads/init")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("signature", signature, "fileName", "hello world.txt", "fileSize", fileSize))
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult().getResponseBody();
    }
}
