package com.cronium.runtime.auth;

/**
 * Raised when an execution token is missing, malformed, badly signed or expired.
 * The message is safe to return to the caller.
 */
public class TokenVerificationException extends RuntimeException {

    public TokenVerificationException(String message) {
        super(message);
    }

    public TokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
