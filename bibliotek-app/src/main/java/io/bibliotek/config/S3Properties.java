package io.bibliotek.config;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class S3Properties {
    /** Empty means the SDK resolves the AWS endpoint from the region. */
    private String endpoint;
    private String region;
    private String accessKey;
    private String secretKey;
    private Integer maxConnections;
    private Integer connectionTimeout;
    private Integer socketTimeout;

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }

    public boolean hasStaticCredentials() {
        return accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank();
    }
}
