package com.cronium.runtime.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Base64;

/**
 * Verifies HS256-signed execution tokens issued by the orchestrator.
 *
 * Token layout is a compact JWS: base64url(header).base64url(payload).base64url(signature).
 * Verification is pure computation over the token and the shared secret; it
 * never touches the network or the state store, so it can run on every request.
 *
 * Required claims: executionId, exp. Optional: jobId, userId, eventId, iat.
 * Timestamps are epoch seconds.
 */
@Component
public class TokenVerifier {

    private static final String JWS_ALGORITHM  = "HS256";
    private static final String MAC_ALGORITHM  = "HmacSHA256";

    private static final Base64.Decoder B64_DECODER = Base64.getUrlDecoder();
    private static final Base64.Encoder B64_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecretKeySpec key;
    private final ObjectMapper  json;
    private final Clock         clock;

    public TokenVerifier(@Value("${runtime.jwt.secret}") String secret,
                         ObjectMapper objectMapper,
                         Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("runtime.jwt.secret must be configured");
        }
        this.key   = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), MAC_ALGORITHM);
        this.json  = objectMapper;
        this.clock = clock;
    }

    /**
     * Verify the token and return its claims.
     *
     * @throws TokenVerificationException if the token is malformed, the
     *         signature does not match, or the token has expired
     */
    public ExecutionClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException("Missing execution token");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new TokenVerificationException("Malformed execution token");
        }

        JsonNode header = decodeJson(parts[0], "header");
        if (!JWS_ALGORITHM.equals(header.path("alg").asText(null))) {
            throw new TokenVerificationException("Unsupported token algorithm");
        }

        // Compare the canonical encoding rather than the decoded bytes: base64url
        // tolerates flipped padding bits, which would otherwise still verify.
        byte[] expected = B64_ENCODER.encode(sign(parts[0] + "." + parts[1]));
        byte[] actual   = parts[2].getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new TokenVerificationException("Invalid token signature");
        }

        JsonNode payload = decodeJson(parts[1], "payload");
        ExecutionClaims claims = toClaims(payload);
        if (!claims.expiresAt().isAfter(clock.instant())) {
            throw new TokenVerificationException("Execution token expired");
        }
        return claims;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private byte[] sign(String signingInput) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(key);
            return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private JsonNode decodeJson(String segment, String name) {
        try {
            JsonNode node = json.readTree(B64_DECODER.decode(segment));
            if (node == null || !node.isObject()) {
                throw new TokenVerificationException("Malformed token " + name);
            }
            return node;
        } catch (IllegalArgumentException | IOException e) {
            throw new TokenVerificationException("Malformed token " + name, e);
        }
    }

    private static ExecutionClaims toClaims(JsonNode payload) {
        String executionId = text(payload, "executionId");
        if (executionId == null || executionId.isBlank()) {
            throw new TokenVerificationException("Token has no executionId claim");
        }
        JsonNode exp = payload.get("exp");
        if (exp == null || !exp.canConvertToLong()) {
            throw new TokenVerificationException("Token has no exp claim");
        }
        JsonNode iat = payload.get("iat");
        return new ExecutionClaims(
                text(payload, "jobId"),
                executionId,
                text(payload, "userId"),
                text(payload, "eventId"),
                iat != null && iat.canConvertToLong() ? epochSeconds(iat, "iat") : null,
                epochSeconds(exp, "exp"));
    }

    private static Instant epochSeconds(JsonNode value, String claim) {
        try {
            return Instant.ofEpochSecond(value.asLong());
        } catch (DateTimeException e) {
            throw new TokenVerificationException("Token " + claim + " claim out of range", e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
