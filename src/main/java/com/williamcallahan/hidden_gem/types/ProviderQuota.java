/**
 * Request counters of one media provider
 *
 * Features:
 * - Tracks requests made today, the next quota reset and the last granted request slot
 * - Resets itself once the clock passes the reset instant (next UTC midnight)
 * - All mutation happens in synchronized methods so check-and-increment is one atomic unit
 */
package com.williamcallahan.hidden_gem.types;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

public class ProviderQuota {

    private final ProviderId providerId;
    private final Duration minInterval;
    private final int dailyLimit;

    private int requestsToday;
    private Instant quotaResetAt;
    private Instant lastRequestAt;

    public ProviderQuota(ProviderId providerId, Duration minInterval, int dailyLimit, Instant now) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("Minimum interval must not be negative for " + providerId);
        }
        if (dailyLimit < 0) {
            throw new IllegalArgumentException("Daily limit must not be negative for " + providerId);
        }
        this.providerId = providerId;
        this.minInterval = minInterval;
        this.dailyLimit = dailyLimit;
        this.quotaResetAt = nextUtcMidnight(now);
    }

    /**
     * Reserves the next request slot
     *
     * @param now current instant
     * @return delay until the reserved slot, or null when the daily quota is exhausted
     */
    public synchronized Duration reserve(Instant now) {
        rollOverIfDue(now);
        if (requestsToday >= dailyLimit) {
            return null;
        }
        Instant slot = now;
        if (lastRequestAt != null) {
            Instant earliest = lastRequestAt.plus(minInterval);
            if (earliest.isAfter(now)) {
                slot = earliest;
            }
        }
        lastRequestAt = slot;
        requestsToday++;
        return Duration.between(now, slot);
    }

    /**
     * Marks the quota as used up until the next reset, e.g. after an HTTP 429 from the provider
     */
    public synchronized void exhaust(Instant now) {
        rollOverIfDue(now);
        requestsToday = Math.max(requestsToday, dailyLimit);
    }

    public synchronized boolean isExhausted(Instant now) {
        rollOverIfDue(now);
        return requestsToday >= dailyLimit;
    }

    public synchronized int getRequestsToday() {
        return requestsToday;
    }

    public synchronized Instant getQuotaResetAt() {
        return quotaResetAt;
    }

    public synchronized Instant getLastRequestAt() {
        return lastRequestAt;
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    public Duration getMinInterval() {
        return minInterval;
    }

    public int getDailyLimit() {
        return dailyLimit;
    }

    private void rollOverIfDue(Instant now) {
        if (!now.isBefore(quotaResetAt)) {
            requestsToday = 0;
            quotaResetAt = nextUtcMidnight(now);
        }
    }

    private static Instant nextUtcMidnight(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    @Override
    public synchronized String toString() {
        return providerId + "[requestsToday=" + requestsToday + "/" + dailyLimit
            + ", resetAt=" + quotaResetAt + ", lastRequestAt=" + lastRequestAt + "]";
    }
}
