package io.bibliotek.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.time.Duration;

@Slf4j
@Configuration
public class S3Config {

    @Bean
    S3Properties s3Properties(@Value("${s3.endpoint:}") String endpoint,
                              @Value("${s3.region:us-east-1}") String region,
                              @Value("${s3.access-key:}") String accessKey,
                              @Value("${s3.secret-key:}") String secretKey,
                              @Value("${s3.max-connections:100}") Integer maxConnections,
                              @Value("${s3.connection-timeout:10}") Integer connectionTimeout,
                              @Value("${s3.socket-timeout:60}") Integer socketTimeout) {
        return S3Properties.builder()
                .endpoint(endpoint)
                .region(region)
                .accessKey(accessKey)
                .secretKey(secretKey)
                .maxConnections(maxConnections)
                .connectionTimeout(connectionTimeout)
                .socketTimeout(socketTimeout)
                .build();
    }

    @Bean(destroyMethod = "close")
    public S3AsyncClient s3AsyncClient(S3Properties s3Properties) {
        log.info("Configuring S3 client for region {} at {}", s3Properties.getRegion(),
                s3Properties.hasEndpoint() ? s3Properties.getEndpoint() : "the AWS default endpoint");

        S3AsyncClientBuilder builder = S3AsyncClient.builder()
                .region(Region.of(s3Properties.getRegion()))
                .credentialsProvider(credentialsProvider(s3Properties))
                .httpClientBuilder(NettyNioAsyncHttpClient.builder()
                        .maxConcurrency(s3Properties.getMaxConnections())
                        .connectionTimeout(Duration.ofSeconds(s3Properties.getConnectionTimeout()))
                        .readTimeout(Duration.ofSeconds(s3Properties.getSocketTimeout()))
                        .writeTimeout(Duration.ofSeconds(s3Properties.getSocketTimeout())));

        // S3-compatible servers (MinIO, S3Mock) need path-style addressing
        if (s3Properties.hasEndpoint()) {
            builder.endpointOverride(URI.create(s3Properties.getEndpoint()))
                    .forcePathStyle(true);
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner(S3Properties s3Properties) {
        S3Presigner.Builder builder = S3Presigner.builder()
                .region(Region.of(s3Properties.getRegion()))
                .credentialsProvider(credentialsProvider(s3Properties));

        if (s3Properties.hasEndpoint()) {
            builder.endpointOverride(URI.create(s3Properties.getEndpoint()))
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        }
        return builder.build();
    }

    private static AwsCredentialsProvider credentialsProvider(S3Properties s3Properties) {
        if (s3Properties.hasStaticCredentials()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(s3Properties.getAccessKey(), s3Properties.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
