package com.cronium.runtime.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-instance rate limiter holding one counter per caller in memory.
 *
 * Memory is capped at {@code maxTrackedCallers} entries. The slot for a new
 * caller is reserved inside the same atomic map update that creates its
 * counter, so concurrent callers cannot push the map past the cap. At the cap
 * new callers are rejected; {@link #sweep()} frees the slots of closed windows.
 */
public class InMemoryRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRateLimiter.class);

    private record Window(long index, int count) {}

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
    private final AtomicInteger tracked = new AtomicInteger();
    private final int   limit;
    private final int   maxTrackedCallers;
    private final Clock clock;

    public InMemoryRateLimiter(int limit, int maxTrackedCallers, Clock clock) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        this.limit             = limit;
        this.maxTrackedCallers = maxTrackedCallers;
        this.clock             = clock;
    }

    @Override
    public RateLimitDecision tryAcquire(String callerKey) {
        long now   = clock.millis();
        long index = RateLimiter.windowIndex(now);

        Window window = windows.compute(callerKey, (k, current) -> {
            if (current == null) {
                if (tracked.incrementAndGet() > maxTrackedCallers) {
                    tracked.decrementAndGet();
                    return null;
                }
                return new Window(index, 1);
            }
            return current.index() != index
                    ? new Window(index, 1)
                    : new Window(index, current.count() + 1);
        });

        if (window == null) {
            log.warn("Rate limiter at capacity ({} callers), rejecting new caller {}", maxTrackedCallers, callerKey);
            return RateLimitDecision.reject(RateLimiter.untilWindowEnd(now));
        }
        if (window.count() <= limit) {
            return RateLimitDecision.allow(limit - window.count());
        }
        return RateLimitDecision.reject(RateLimiter.untilWindowEnd(now));
    }

    @Override
    public int limit() {
        return limit;
    }

    @Override
    public int sweep() {
        return evictBefore(RateLimiter.windowIndex(clock.millis()));
    }

    int trackedCallers() {
        return windows.size();
    }

    private int evictBefore(long index) {
        int removed = 0;
        for (Map.Entry<String, Window> entry : windows.entrySet()) {
            Window window = entry.getValue();
            if (window.index() < index && windows.remove(entry.getKey(), window)) {
                tracked.decrementAndGet();
                removed++;
            }
        }
        return removed;
    }
}
