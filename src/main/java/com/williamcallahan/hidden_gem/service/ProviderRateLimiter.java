/**
 * Rate limiter enforcing request spacing and daily quotas per media provider
 *
 * Features:
 * - One ProviderQuota per provider, created at startup and shared by all resolutions
 * - Callers under quota are delayed until the minimum spacing is met, never rejected
 * - Callers over quota are rejected immediately so the provider walk can move on
 * - An HTTP 429 from a provider closes its quota until the next UTC midnight
 */
package com.williamcallahan.hidden_gem.service;

import com.williamcallahan.hidden_gem.types.ProviderId;
import com.williamcallahan.hidden_gem.types.ProviderQuota;
import com.williamcallahan.hidden_gem.types.RateLimitDecision;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class ProviderRateLimiter {

    private final Clock clock;
    private final Map<ProviderId, ProviderQuota> quotas = new EnumMap<>(ProviderId.class);

    public ProviderRateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers the limits of a provider; intended for startup wiring only
     *
     * @param providerId provider to limit
     * @param minInterval minimum spacing between two requests
     * @param dailyLimit requests allowed per UTC day
     * @return this limiter for chaining
     */
    public synchronized ProviderRateLimiter register(ProviderId providerId, Duration minInterval, int dailyLimit) {
        quotas.put(providerId, new ProviderQuota(providerId, minInterval, dailyLimit, clock.instant()));
        log.info("Registered rate limit for {}: min interval {} ms, {} requests/day",
            providerId.getDisplayName(), minInterval.toMillis(), dailyLimit);
        return this;
    }

    /**
     * Acquires permission for one request to the given provider
     * - Slot reservation and counter increment happen atomically inside the provider's quota
     * - The wait for the reserved slot happens outside any lock
     *
     * @param providerId provider about to be called
     * @return decision with the time waited; proceed=false without waiting when the quota is used up
     */
    public RateLimitDecision acquire(ProviderId providerId) {
        ProviderQuota quota = quotaFor(providerId);
        Duration wait = quota.reserve(clock.instant());
        if (wait == null) {
            log.info("Daily quota exhausted for {} ({} requests), skipping until {}",
                providerId.getDisplayName(), quota.getDailyLimit(), quota.getQuotaResetAt());
            return RateLimitDecision.denied();
        }
        if (!wait.isZero()) {
            log.debug("Delaying {} request by {} ms to respect minimum spacing", providerId.getDisplayName(), wait.toMillis());
            try {
                Thread.sleep(wait.toMillis(), wait.toNanosPart() % 1_000_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Interrupted while waiting for {} rate limit slot", providerId.getDisplayName());
                return RateLimitDecision.denied();
            }
        }
        return RateLimitDecision.granted(wait);
    }

    /**
     * Records a rate limit response (HTTP 429) from a provider
     * - Closes the provider's quota for the remainder of the UTC day
     */
    public void recordRateLimited(ProviderId providerId) {
        ProviderQuota quota = quotaFor(providerId);
        quota.exhaust(clock.instant());
        log.warn("{} answered with a rate limit response - blocking further calls until {}",
            providerId.getDisplayName(), quota.getQuotaResetAt());
    }

    public boolean isExhausted(ProviderId providerId) {
        return quotaFor(providerId).isExhausted(clock.instant());
    }

    public synchronized Optional<ProviderQuota> getQuota(ProviderId providerId) {
        return Optional.ofNullable(quotas.get(providerId));
    }

    /**
     * Current limiter status for monitoring/debugging
     */
    public synchronized String getStatus() {
        StringBuilder status = new StringBuilder();
        quotas.values().forEach(q -> {
            if (status.length() > 0) {
                status.append(", ");
            }
            status.append(q);
        });
        return status.toString();
    }

    private synchronized ProviderQuota quotaFor(ProviderId providerId) {
        ProviderQuota quota = quotas.get(providerId);
        if (quota == null) {
            throw new IllegalArgumentException("No rate limit registered for provider " + providerId);
        }
        return quota;
    }
}
