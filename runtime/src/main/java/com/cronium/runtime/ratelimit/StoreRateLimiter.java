package com.cronium.runtime.ratelimit;

import com.cronium.runtime.store.ExecutionStateStore;
import com.cronium.runtime.store.StateKey;
import com.cronium.runtime.store.StateType;

import java.time.Clock;

/**
 * Rate limiter whose counters live in the execution state store, so every
 * instance behind a load balancer sees the same counts.
 *
 * Each check is one atomic increment on the key (RATE, caller, window).
 * Counters are eventually consistent across instances, which is all a
 * throttle needs. Store failures propagate and the request is rejected as
 * Unavailable.
 */
public class StoreRateLimiter implements RateLimiter {

    private final ExecutionStateStore store;
    private final int                 limit;
    private final Clock               clock;

    public StoreRateLimiter(ExecutionStateStore store, int limit, Clock clock) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        this.store = store;
        this.limit = limit;
        this.clock = clock;
    }

    @Override
    public RateLimitDecision tryAcquire(String callerKey) {
        long now   = clock.millis();
        long count = store.increment(StateKey.rateWindow(callerKey, RateLimiter.windowIndex(now)));
        if (count <= limit) {
            return RateLimitDecision.allow(limit - count);
        }
        return RateLimitDecision.reject(RateLimiter.untilWindowEnd(now));
    }

    @Override
    public int limit() {
        return limit;
    }

    /** Delete counters untouched for two windows; they can no longer affect a decision. */
    @Override
    public int sweep() {
        return store.deleteExpired(StateType.RATE, clock.instant().minus(WINDOW.multipliedBy(2)));
    }
}
