package io.bibliotek.scheduling;

import io.bibliotek.config.UploadProperties;
import io.bibliotek.upload.service.ExpiryReaper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Runs the expiry sweep periodically for as long as the application is up.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "upload.reaper.enabled", havingValue = "true", matchIfMissing = true)
public class ExpiryReaperScheduler {

    private final ExpiryReaper expiryReaper;
    private final UploadProperties uploadProperties;
    private Disposable subscription;

    public ExpiryReaperScheduler(ExpiryReaper expiryReaper, UploadProperties uploadProperties) {
        this.expiryReaper = expiryReaper;
        this.uploadProperties = uploadProperties;
    }

    @PostConstruct
    public void start() {
        start(Schedulers.parallel());
    }

    void start(Scheduler scheduler) {
        long maxAgeHours = uploadProperties.getReaperMaxAgeHours();
        log.info("Expiry reaper runs every {} (first run after {}), aborting sessions older than {}h",
                uploadProperties.getReaperInterval(), uploadProperties.getReaperInitialDelay(), maxAgeHours);

        // A sweep still running when the next tick fires makes that tick a no-op
        subscription = Flux.interval(uploadProperties.getReaperInitialDelay(), uploadProperties.getReaperInterval(), scheduler)
                .onBackpressureDrop(tick -> log.debug("Skipping reaper tick {}, previous sweep still running", tick))
                .concatMap(tick -> expiryReaper.sweep(maxAgeHours)
                        .onErrorResume(error -> {
                            log.error("Expiry sweep failed: {}", error.getMessage(), error);
                            return Mono.empty();
                        }), 1)
                .subscribe();
    }

    @PreDestroy
    public void stop() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            log.info("Expiry reaper stopped");
        }
    }
}
