package com.cronium.sdk;

/**
 * No answer within the deadline: either the SDK's own request timeout
 * expired (status 0) or the Runtime API reported DeadlineExceeded (504).
 *
 * For tool actions the outcome is unknown; the action may have run.
 */
public class CroniumTimeoutException extends CroniumException {

    public CroniumTimeoutException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, "DeadlineExceeded", cause);
    }
}
