/**
 * Scheduler for catalog media prefetch
 * - Runs during off-peak hours so provider quotas are spent before user traffic
 * - Disabled by default, enabled with {@code app.prefetch.enabled}
 * - Skips a run while the previous one is still going
 */
package com.williamcallahan.hidden_gem.scheduler;

import com.williamcallahan.hidden_gem.service.MediaPrefetchService;
import com.williamcallahan.hidden_gem.service.PrefetchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

@Configuration
@EnableScheduling
public class MediaPrefetchScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MediaPrefetchScheduler.class);

    private final MediaPrefetchService prefetchService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Value("${app.prefetch.enabled:false}")
    private boolean prefetchEnabled;

    public MediaPrefetchScheduler(MediaPrefetchService prefetchService) {
        this.prefetchService = prefetchService;
    }

    @Scheduled(cron = "${app.prefetch.cron:0 0 4 * * ?}")
    public void prefetchCatalogMedia() {
        if (!prefetchEnabled) {
            logger.debug("Catalog media prefetch is disabled");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            logger.info("Previous catalog media prefetch still running, skipping this run");
            return;
        }
        logger.info("Starting scheduled catalog media prefetch");
        CompletableFuture<PrefetchSummary> run;
        try {
            run = prefetchService.prefetchAsync();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        run.whenComplete((summary, error) -> {
            running.set(false);
            if (error != null) {
                logger.error("Scheduled catalog media prefetch failed: {}", error.getMessage(), error);
            } else {
                logger.info("Scheduled catalog media prefetch done: {}", summary);
            }
        });
    }

    boolean isRunning() {
        return running.get();
    }

    void setPrefetchEnabled(boolean prefetchEnabled) {
        this.prefetchEnabled = prefetchEnabled;
    }
}
