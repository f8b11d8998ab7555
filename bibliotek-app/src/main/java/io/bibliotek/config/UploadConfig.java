package io.bibliotek.config;

import io.bibliotek.upload.config.UploadLimits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class UploadConfig {

    @Bean
    UploadProperties uploadProperties(@Value("${upload.default-chunk-size:5MB}") DataSize defaultChunkSize,
                                      @Value("${upload.max-request-chunk-size:64MB}") DataSize maxRequestChunkSize,
                                      @Value("${upload.download-url-ttl:PT1H}") Duration downloadUrlTtl,
                                      @Value("${upload.reaper.enabled:true}") boolean reaperEnabled,
                                      @Value("${upload.reaper.interval:PT1H}") Duration reaperInterval,
                                      @Value("${upload.reaper.initial-delay:PT5M}") Duration reaperInitialDelay,
                                      @Value("${upload.reaper.max-age-hours:24}") long reaperMaxAgeHours) {
        return UploadProperties.builder()
                .defaultChunkSize(defaultChunkSize.toBytes())
                .maxRequestChunkSize(maxRequestChunkSize.toBytes())
                .downloadUrlTtl(downloadUrlTtl)
                .reaperEnabled(reaperEnabled)
                .reaperInterval(reaperInterval)
                .reaperInitialDelay(reaperInitialDelay)
                .reaperMaxAgeHours(reaperMaxAgeHours)
                .build();
    }

    @Bean
    UploadLimits uploadLimits(UploadProperties uploadProperties) {
        UploadLimits limits = new UploadLimits(uploadProperties.getDefaultChunkSize());
        log.info("New uploads use chunks of {} bytes, up to {} bytes per file",
                limits.defaultChunkSize(), limits.maxFileSizeFor(limits.defaultChunkSize()));
        return limits;
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
