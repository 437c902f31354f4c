package com.cronium.sdk;

/**
 * Base of every error the SDK raises.
 *
 * {@link #getStatusCode()} is the HTTP status of the Runtime API response, or
 * 0 when no response was received. {@link #getErrorCode()} is the API's error
 * code ("NotFound", "RateLimited", ...) when the response carried one.
 */
public class CroniumException extends RuntimeException {

    private final int    statusCode;
    private final String errorCode;

    public CroniumException(String message) {
        this(message, 0, null, null);
    }

    public CroniumException(String message, Throwable cause) {
        this(message, 0, null, cause);
    }

    protected CroniumException(String message, int statusCode, String errorCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode  = errorCode;
    }

    public int getStatusCode() { return statusCode; }

    public String getErrorCode() { return errorCode; }

    /** Whether the same call may succeed if repeated later. */
    public boolean isRetryable() {
        return false;
    }
}
