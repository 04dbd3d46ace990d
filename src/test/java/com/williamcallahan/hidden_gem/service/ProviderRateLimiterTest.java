package com.williamcallahan.hidden_gem.service;

import com.williamcallahan.hidden_gem.testutil.MutableClock;
import com.williamcallahan.hidden_gem.types.ProviderId;
import com.williamcallahan.hidden_gem.types.RateLimitDecision;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRateLimiterTest {

    private static final Instant NOON = Instant.parse("2026-03-14T12:00:00Z");

    @Test
    void deniesImmediatelyOnceDailyQuotaIsUsed() {
        MutableClock clock = new MutableClock(NOON);
        ProviderRateLimiter limiter = new ProviderRateLimiter(clock).register(ProviderId.RAWG, Duration.ZERO, 3);

        for (int i = 0; i < 3; i++) {
            assertThat(limiter.acquire(ProviderId.RAWG).proceed()).isTrue();
        }
        RateLimitDecision denied = limiter.acquire(ProviderId.RAWG);

        assertThat(denied.proceed()).isFalse();
        assertThat(denied.waitDuration()).isZero();
        assertThat(limiter.isExhausted(ProviderId.RAWG)).isTrue();
    }

    @Test
    void quotaResetsAtUtcMidnight() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-14T23:59:00Z"));
        ProviderRateLimiter limiter = new ProviderRateLimiter(clock).register(ProviderId.THE_GAMES_DB, Duration.ZERO, 1);

        assertThat(limiter.acquire(ProviderId.THE_GAMES_DB).proceed()).isTrue();
        assertThat(limiter.acquire(ProviderId.THE_GAMES_DB).proceed()).isFalse();

        clock.advance(Duration.ofMinutes(2));

        assertThat(limiter.acquire(ProviderId.THE_GAMES_DB).proceed()).isTrue();
        assertThat(limiter.getQuota(ProviderId.THE_GAMES_DB).orElseThrow().getQuotaResetAt())
            .isEqualTo(Instant.parse("2026-03-16T00:00:00Z"));
    }

    @Test
    void rateLimitResponseClosesQuotaUntilReset() {
        MutableClock clock = new MutableClock(NOON);
        ProviderRateLimiter limiter = new ProviderRateLimiter(clock).register(ProviderId.RAWG, Duration.ZERO, 600);

        limiter.recordRateLimited(ProviderId.RAWG);

        assertThat(limiter.acquire(ProviderId.RAWG).proceed()).isFalse();
        clock.set(Instant.parse("2026-03-15T00:00:01Z"));
        assertThat(limiter.acquire(ProviderId.RAWG).proceed()).isTrue();
    }

    @Test
    void providersAreLimitedIndependently() {
        MutableClock clock = new MutableClock(NOON);
        ProviderRateLimiter limiter = new ProviderRateLimiter(clock)
            .register(ProviderId.RAWG, Duration.ZERO, 1)
            .register(ProviderId.THE_GAMES_DB, Duration.ZERO, 1);

        limiter.acquire(ProviderId.RAWG);

        assertThat(limiter.acquire(ProviderId.RAWG).proceed()).isFalse();
        assertThat(limiter.acquire(ProviderId.THE_GAMES_DB).proceed()).isTrue();
    }

    @Test
    void unregisteredProviderIsRejected() {
        ProviderRateLimiter limiter = new ProviderRateLimiter(new MutableClock(NOON));

        assertThatThrownBy(() -> limiter.acquire(ProviderId.RAWG)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentCallersNeverOvershootTheQuota() throws Exception {
        MutableClock clock = new MutableClock(NOON);
        ProviderRateLimiter limiter = new ProviderRateLimiter(clock).register(ProviderId.RAWG, Duration.ZERO, 50);

        List<RateLimitDecision> decisions = runConcurrently(200, () -> limiter.acquire(ProviderId.RAWG));

        assertThat(decisions.stream().filter(RateLimitDecision::proceed).count()).isEqualTo(50);
        assertThat(limiter.getQuota(ProviderId.RAWG).orElseThrow().getRequestsToday()).isEqualTo(50);
    }

    @Test
    void concurrentCallersReceiveDistinctSpacedSlots() throws Exception {
        // Frozen clock: every caller reserves at the same instant, so waits must be 0, 20, 40, ... ms
        MutableClock clock = new MutableClock(NOON);
        ProviderRateLimiter limiter = new ProviderRateLimiter(clock).register(ProviderId.RAWG, Duration.ofMillis(20), 100);

        List<RateLimitDecision> decisions = runConcurrently(8, () -> limiter.acquire(ProviderId.RAWG));

        List<Long> waits = decisions.stream().map(d -> d.waitDuration().toMillis()).sorted().toList();
        assertThat(waits).containsExactly(0L, 20L, 40L, 60L, 80L, 100L, 120L, 140L);
    }

    @Test
    void sequentialCallsAreSpacedByTheMinimumInterval() {
        ProviderRateLimiter limiter = new ProviderRateLimiter(Clock.systemUTC())
            .register(ProviderId.THE_GAMES_DB, Duration.ofMillis(50), 100);

        List<Long> timestamps = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            assertThat(limiter.acquire(ProviderId.THE_GAMES_DB).proceed()).isTrue();
            timestamps.add(System.nanoTime());
        }

        // The first call is granted without waiting; every later one waits for its slot
        long spanMillis = TimeUnit.NANOSECONDS.toMillis(timestamps.get(3) - timestamps.get(0));
        assertThat(spanMillis).isGreaterThanOrEqualTo(145L);
    }

    private static <T> List<T> runConcurrently(int callers, Callable<T> call) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(callers, 32));
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }
}
