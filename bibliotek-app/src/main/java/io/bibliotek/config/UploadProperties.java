package io.bibliotek.config;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

@Data
@Builder
public class UploadProperties {
    private long defaultChunkSize;
    /** Upper bound for a single part request body; the server rejects larger chunks with 413. */
    private long maxRequestChunkSize;
    private Duration downloadUrlTtl;

    @Builder.Default
    private boolean reaperEnabled = true;
    private Duration reaperInterval;
    private Duration reaperInitialDelay;
    private long reaperMaxAgeHours;
}
