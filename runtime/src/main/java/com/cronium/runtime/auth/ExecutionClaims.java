package com.cronium.runtime.auth;

import java.time.Instant;

/**
 * Verified, immutable claims decoded from an execution token.
 *
 * Only {@link TokenVerifier} creates these. Everything downstream of the
 * authentication filter scopes its work by {@link #executionId()} and never
 * by a client-supplied id.
 */
public record ExecutionClaims(
        String  jobId,
        String  executionId,
        String  userId,
        String  eventId,
        Instant issuedAt,
        Instant expiresAt
) {
    /** True when the token was issued for the given execution. */
    public boolean owns(String executionId) {
        return this.executionId.equals(executionId);
    }
}
