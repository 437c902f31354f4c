package com.cronium.sdk;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * How the client retries failed calls.
 *
 * Delays grow exponentially from {@code initialDelay} by {@code multiplier},
 * are randomized by {@code randomizationFactor} either way and never exceed
 * {@code maxDelay}. {@code maxAttempts} counts the first call.
 *
 * @param maxAttempts         total attempts including the first, at least 1
 * @param initialDelay        delay before the second attempt
 * @param multiplier          growth factor between consecutive delays
 * @param randomizationFactor jitter, 0 for none, below 1
 * @param maxDelay            upper bound on any single delay
 */
public record RetryPolicy(
        int      maxAttempts,
        Duration initialDelay,
        double   multiplier,
        double   randomizationFactor,
        Duration maxDelay
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
        if (randomizationFactor < 0 || randomizationFactor >= 1) {
            throw new IllegalArgumentException("randomizationFactor must be in [0, 1)");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be below initialDelay");
        }
    }

    /** 3 attempts, 1s initial delay doubling with 20% jitter, capped at 10s. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, 0.2, Duration.ofSeconds(10));
    }

    /** A single attempt, no retries. */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ofSeconds(1), 1.0, 0.0, Duration.ofSeconds(1));
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param failedAttempt 1 for the first call
     */
    public Duration delayAfter(int failedAttempt) {
        IntervalFunction backoff = IntervalFunction.ofExponentialRandomBackoff(
                initialDelay, multiplier, randomizationFactor, maxDelay);
        return Duration.ofMillis(Math.min(backoff.apply(failedAttempt), maxDelay.toMillis()));
    }
}
