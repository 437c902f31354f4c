package com.cronium.sdk;

import java.time.Duration;
import java.util.Optional;

/** Too many requests from this execution in the current window. */
public class RateLimitedException extends CroniumException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message, 429, "RateLimited", null);
        this.retryAfter = retryAfter;
    }

    /** The server's hint for when to try again, if it sent one. */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
