package com.cronium.runtime.ratelimit;

import com.cronium.runtime.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRateLimiterTest {

    // 15 seconds into a one-minute window.
    static final Instant START = Instant.parse("2026-01-15T10:00:15Z");

    MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
    }

    @Test
    void tryAcquire_withinLimit_allowedWithRemainingCount() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(3, 100, clock);

        assertThat(limiter.tryAcquire("exec-1").remaining()).isEqualTo(2);
        assertThat(limiter.tryAcquire("exec-1").remaining()).isEqualTo(1);
        RateLimitDecision third = limiter.tryAcquire("exec-1");
        assertThat(third.allowed()).isTrue();
        assertThat(third.remaining()).isZero();
    }

    @Test
    void tryAcquire_overLimit_rejectedWithRetryHintUntilWindowEnd() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(3, 100, clock);
        for (int i = 0; i < 3; i++) {
            assertThat(limiter.allow("exec-1")).isTrue();
        }

        RateLimitDecision rejected = limiter.tryAcquire("exec-1");

        assertThat(rejected.allowed()).isFalse();
        assertThat(rejected.retryAfter()).isEqualTo(Duration.ofSeconds(45));
        assertThat(rejected.retryAfterSeconds()).isEqualTo(45);
    }

    @Test
    void tryAcquire_afterWindowRollover_allowedAgain() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(2, 100, clock);
        limiter.tryAcquire("exec-1");
        limiter.tryAcquire("exec-1");
        assertThat(limiter.allow("exec-1")).isFalse();

        clock.advance(Duration.ofSeconds(45));

        RateLimitDecision decision = limiter.tryAcquire("exec-1");
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(1);
    }

    @Test
    void tryAcquire_callersHaveIndependentBudgets() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(1, 100, clock);

        assertThat(limiter.allow("exec-1")).isTrue();
        assertThat(limiter.allow("exec-1")).isFalse();
        assertThat(limiter.allow("exec-2")).isTrue();
    }

    @Test
    void tryAcquire_atCallerCap_rejectsNewCallerWhileOthersActive() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(10, 2, clock);
        limiter.tryAcquire("exec-1");
        limiter.tryAcquire("exec-2");

        assertThat(limiter.allow("exec-3")).isFalse();
        assertThat(limiter.trackedCallers()).isEqualTo(2);
        // Known callers are unaffected.
        assertThat(limiter.allow("exec-1")).isTrue();
    }

    @Test
    void tryAcquire_atCallerCap_newCallerWaitsForSweep() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(10, 2, clock);
        limiter.tryAcquire("exec-1");
        limiter.tryAcquire("exec-2");

        clock.advance(Duration.ofMinutes(1));
        assertThat(limiter.allow("exec-3")).isFalse();

        assertThat(limiter.sweep()).isEqualTo(2);
        assertThat(limiter.allow("exec-3")).isTrue();
        assertThat(limiter.trackedCallers()).isEqualTo(1);
    }

    @Test
    void tryAcquire_concurrentNewCallers_neverExceedCap() throws Exception {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(10, 10, clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger allowed = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String caller = "exec-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    if (limiter.allow(caller)) {
                        allowed.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(allowed.get()).isEqualTo(10);
        assertThat(limiter.trackedCallers()).isEqualTo(10);
    }

    @Test
    void sweep_removesOnlyClosedWindows() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(10, 100, clock);
        limiter.tryAcquire("exec-1");
        clock.advance(Duration.ofMinutes(1));
        limiter.tryAcquire("exec-2");

        assertThat(limiter.sweep()).isEqualTo(1);
        assertThat(limiter.trackedCallers()).isEqualTo(1);
    }

    @Test
    void constructor_zeroLimit_rejected() {
        assertThatThrownBy(() -> new InMemoryRateLimiter(0, 100, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
