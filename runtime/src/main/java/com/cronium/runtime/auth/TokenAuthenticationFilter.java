package com.cronium.runtime.auth;

import com.cronium.runtime.error.ErrorCode;
import com.cronium.runtime.web.ErrorResponseWriter;
import com.cronium.runtime.web.ProtectedRoutes;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * First gate of every protected route: requires {@code Authorization: Bearer <token>}
 * and a token that passes {@link TokenVerifier}.
 *
 * On failure the request ends here with 401 Unauthenticated and no handler runs.
 * On success the claims are published through {@link RequestClaims} and the
 * execution id is added to the MDC for the rest of the request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TokenAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthenticationFilter.class);

    private static final String BEARER_PREFIX    = "Bearer ";
    private static final String MDC_EXECUTION_ID = "executionId";

    private final TokenVerifier       verifier;
    private final ErrorResponseWriter errorWriter;
    private final MeterRegistry       meterRegistry;

    public TokenAuthenticationFilter(TokenVerifier verifier,
                                     ErrorResponseWriter errorWriter,
                                     MeterRegistry meterRegistry) {
        this.verifier      = verifier;
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
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            reject(request, response, "Missing bearer token");
            return;
        }

        ExecutionClaims claims;
        try {
            claims = verifier.verify(header.substring(BEARER_PREFIX.length()).trim());
        } catch (TokenVerificationException e) {
            reject(request, response, e.getMessage());
            return;
        }

        RequestClaims.set(request, claims);
        MDC.put(MDC_EXECUTION_ID, claims.executionId());
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_EXECUTION_ID);
        }
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String reason)
            throws IOException {
        log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), reason);
        meterRegistry.counter("cronium.runtime.rejections", "reason", "unauthenticated").increment();
        errorWriter.write(response, ErrorCode.UNAUTHENTICATED, reason);
    }
}
