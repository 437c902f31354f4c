package com.cronium.runtime.ratelimit;

import java.time.Duration;

/**
 * Per-caller request throttle in front of every protected route.
 *
 * Fixed one-minute windows: a caller may make {@link #limit()} requests per
 * window, the next request is rejected until the window rolls over.
 * Implementations must answer in O(1) and keep memory bounded.
 */
public interface RateLimiter {

    Duration WINDOW = Duration.ofMinutes(1);

    RateLimitDecision tryAcquire(String callerKey);

    default boolean allow(String callerKey) {
        return tryAcquire(callerKey).allowed();
    }

    /** Requests allowed per window. */
    int limit();

    /** Drop bookkeeping for windows that have closed; returns how many entries were removed. */
    int sweep();

    static long windowIndex(long epochMillis) {
        return epochMillis / WINDOW.toMillis();
    }

    static Duration untilWindowEnd(long epochMillis) {
        long windowMillis = WINDOW.toMillis();
        return Duration.ofMillis((windowIndex(epochMillis) + 1) * windowMillis - epochMillis);
    }
}
