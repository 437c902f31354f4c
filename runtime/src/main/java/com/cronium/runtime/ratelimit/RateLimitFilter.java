package com.cronium.runtime.ratelimit;

import com.cronium.runtime.auth.ExecutionClaims;
import com.cronium.runtime.auth.RequestClaims;
import com.cronium.runtime.error.ErrorCode;
import com.cronium.runtime.store.StateStoreUnavailableException;
import com.cronium.runtime.web.ErrorResponseWriter;
import com.cronium.runtime.web.ProtectedRoutes;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Second gate of every protected route, right after authentication.
 * Throttles by the verified execution id, so one runaway script only ever
 * exhausts its own budget.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String LIMIT_HEADER     = "X-RateLimit-Limit";

    private final RateLimiter         rateLimiter;
    private final ErrorResponseWriter errorWriter;
    private final MeterRegistry       meterRegistry;

    public RateLimitFilter(RateLimiter rateLimiter,
                           ErrorResponseWriter errorWriter,
                           MeterRegistry meterRegistry) {
        this.rateLimiter   = rateLimiter;
        this.errorWriter   = errorWriter;
        this.meterRegistry = meterRegistry;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !ProtectedRoutes.requiresAuthentication(request);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        // The authentication filter runs first; without claims there is nothing to key on.
        ExecutionClaims claims = RequestClaims.get(request).orElse(null);
        if (claims == null) {
            errorWriter.write(response, ErrorCode.UNAUTHENTICATED, "No authenticated execution");
            return;
        }

        RateLimitDecision decision;
        try {
            decision = rateLimiter.tryAcquire(claims.executionId());
        } catch (StateStoreUnavailableException e) {
            log.warn("Rate limit check failed for {}: {}", claims.executionId(), e.getMessage());
            errorWriter.write(response, ErrorCode.UNAVAILABLE, "Rate limiter temporarily unavailable");
            return;
        }

        response.setHeader(LIMIT_HEADER, String.valueOf(rateLimiter.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded for {}, retry in {}s",
                    claims.executionId(), decision.retryAfterSeconds());
            meterRegistry.counter("cronium.runtime.rejections", "reason", "rate_limited").increment();
            errorWriter.writeRateLimited(response,
                    "Rate limit of " + rateLimiter.limit() + " requests per minute exceeded",
                    decision.retryAfterSeconds());
            return;
        }
        chain.doFilter(request, response);
    }
}
