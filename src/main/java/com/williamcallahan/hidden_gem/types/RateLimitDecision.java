package com.williamcallahan.hidden_gem.types;

import java.time.Duration;

/**
 * Outcome of a rate limiter acquisition
 *
 * @param proceed false when the daily quota is exhausted (or the wait was interrupted)
 * @param waitDuration time the caller was delayed to respect the minimum request spacing
 */
public record RateLimitDecision(boolean proceed, Duration waitDuration) {

    public static RateLimitDecision denied() {
        return new RateLimitDecision(false, Duration.ZERO);
    }

    public static RateLimitDecision granted(Duration waited) {
        return new RateLimitDecision(true, waited);
    }
}
