/**
 * Service for tracking media resolution metrics
 * Provides counters, gauges and timers for cache efficiency and provider health
 */

package com.williamcallahan.hidden_gem.monitoring;

import com.williamcallahan.hidden_gem.types.ProviderId;
import com.williamcallahan.hidden_gem.types.ResolutionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter cacheHits;
    private final Counter cooldownHits;
    private final Counter dedupedResolutions;
    private final Counter persistedImages;

    // Gauges
    private final AtomicInteger activeResolutions = new AtomicInteger(0);

    // Timers
    private final Timer resolutionTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.cacheHits = Counter.builder("media.cache.hits")
            .description("Resolutions answered from a cache that satisfied the policy")
            .register(meterRegistry);

        this.cooldownHits = Counter.builder("media.cache.cooldown_hits")
            .description("Incomplete games returned as-is because they were resolved recently")
            .register(meterRegistry);

        this.dedupedResolutions = Counter.builder("media.resolutions.deduplicated")
            .description("Resolutions that joined an in-flight resolution of the same game")
            .register(meterRegistry);

        this.persistedImages = Counter.builder("media.images.persisted")
            .description("Provider images written to the media store")
            .register(meterRegistry);

        Gauge.builder("media.resolutions.active", activeResolutions, AtomicInteger::get)
            .description("Resolutions currently walking providers")
            .register(meterRegistry);

        this.resolutionTimer = Timer.builder("media.resolution.duration")
            .description("Duration of fetch-path resolutions")
            .register(meterRegistry);
    }

    public void incrementCacheHit() {
        cacheHits.increment();
    }

    public void incrementCooldownHit() {
        cooldownHits.increment();
    }

    public void incrementDeduplicated() {
        dedupedResolutions.increment();
    }

    public void incrementPersistedImages(int count) {
        persistedImages.increment(count);
    }

    /**
     * Counts a finished resolution by its terminal state and whether it met the policy
     */
    public void recordResolution(ResolutionState outcome, boolean complete) {
        meterRegistry.counter("media.resolutions",
            "outcome", outcome.name().toLowerCase(Locale.ROOT),
            "complete", String.valueOf(complete)).increment();
    }

    public void incrementProviderCall(ProviderId provider, String operation) {
        meterRegistry.counter("media.provider.calls",
            "provider", provider.getDisplayName(), "operation", operation).increment();
    }

    public void incrementProviderFailure(ProviderId provider, boolean rateLimited) {
        meterRegistry.counter("media.provider.failures",
            "provider", provider.getDisplayName(), "rate_limited", String.valueOf(rateLimited)).increment();
    }

    public void incrementQuotaSkip(ProviderId provider) {
        meterRegistry.counter("media.provider.quota_skips", "provider", provider.getDisplayName()).increment();
    }

    public void incrementActiveResolutions() {
        activeResolutions.incrementAndGet();
    }

    public void decrementActiveResolutions() {
        activeResolutions.decrementAndGet();
    }

    public Timer.Sample startResolutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopResolutionTimer(Timer.Sample sample) {
        sample.stop(resolutionTimer);
    }
}
