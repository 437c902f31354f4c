package com.cronium.runtime.ratelimit;

import java.time.Duration;

/**
 * Outcome of one rate-limit check.
 *
 * @param allowed    whether the request may proceed
 * @param remaining  requests left in the current window (0 when rejected)
 * @param retryAfter time until the window rolls over; zero when allowed
 */
public record RateLimitDecision(boolean allowed, long remaining, Duration retryAfter) {

    public static RateLimitDecision allow(long remaining) {
        return new RateLimitDecision(true, remaining, Duration.ZERO);
    }

    public static RateLimitDecision reject(Duration retryAfter) {
        return new RateLimitDecision(false, 0, retryAfter);
    }

    /** Retry-After value in whole seconds, rounded up and never below 1. */
    public long retryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
