package com.cronium.runtime.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops counters of closed rate-limit windows so memory (or
 * store rows) stay proportional to the callers active in the current window.
 */
@Component
@EnableScheduling
public class RateLimitSweeper {

    private static final Logger log = LoggerFactory.getLogger(RateLimitSweeper.class);

    private final RateLimiter rateLimiter;

    public RateLimitSweeper(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${runtime.rate-limit.sweep-interval:60000}")
    public void sweep() {
        try {
            int removed = rateLimiter.sweep();
            if (removed > 0) {
                log.debug("Rate limiter sweep removed {} expired windows", removed);
            }
        } catch (RuntimeException e) {
            // Next tick retries; a missed sweep only delays cleanup.
            log.warn("Rate limiter sweep failed: {}", e.getMessage());
        }
    }
}
