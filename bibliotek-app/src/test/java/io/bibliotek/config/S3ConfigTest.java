package io.bibliotek.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import static org.assertj.core.api.Assertions.assertThat;

class S3ConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(S3Config.class)
            .withPropertyValues(
                    "s3.endpoint=http://localhost:9090",
                    "s3.region=eu-central-1",
                    "s3.access-key=mock-access-key",
                    "s3.secret-key=mock-secret-key");

    @Test
    void shouldBuildClientsFromProperties() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(S3AsyncClient.class);
            assertThat(context).hasSingleBean(S3Presigner.class);

            S3Properties properties = context.getBean(S3Properties.class);
            assertThat(properties.getEndpoint()).isEqualTo("http://localhost:9090");
            assertThat(properties.getRegion()).isEqualTo("eu-central-1");
            assertThat(properties.hasStaticCredentials()).isTrue();
            assertThat(properties.getMaxConnections()).isEqualTo(100);
        });
    }

    @Test
    void shouldIgnoreLegacyLocalFlag() {
        contextRunner.withPropertyValues("s3.local=true")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(S3Properties.class);
                });
    }
}
