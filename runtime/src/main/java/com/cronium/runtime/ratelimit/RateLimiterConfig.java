package com.cronium.runtime.ratelimit;

import com.cronium.runtime.store.ExecutionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Picks the rate limiter backend from {@code runtime.rate-limit.backend}:
 * {@code memory} (default, single instance) or {@code store} (shared counters).
 */
@Configuration
public class RateLimiterConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterConfig.class);

    @Bean
    @ConditionalOnProperty(name = "runtime.rate-limit.backend", havingValue = "memory", matchIfMissing = true)
    RateLimiter inMemoryRateLimiter(
            @Value("${runtime.rate-limit.requests-per-minute:600}") int requestsPerMinute,
            @Value("${runtime.rate-limit.max-tracked-callers:10000}") int maxTrackedCallers,
            Clock clock) {
        log.info("Rate limiting {} requests/minute per execution (in-memory, max {} callers)",
                requestsPerMinute, maxTrackedCallers);
        return new InMemoryRateLimiter(requestsPerMinute, maxTrackedCallers, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "runtime.rate-limit.backend", havingValue = "store")
    RateLimiter storeRateLimiter(
            ExecutionStateStore store,
            @Value("${runtime.rate-limit.requests-per-minute:600}") int requestsPerMinute,
            Clock clock) {
        log.info("Rate limiting {} requests/minute per execution (shared store counters)", requestsPerMinute);
        return new StoreRateLimiter(store, requestsPerMinute, clock);
    }
}
