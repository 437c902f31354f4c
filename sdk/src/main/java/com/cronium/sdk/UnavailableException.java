package com.cronium.sdk;

/**
 * The Runtime API or one of its backends could not be reached.
 * Also raised for I/O failures where no response arrived (status 0).
 */
public class UnavailableException extends CroniumException {

    public UnavailableException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, "Unavailable", cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
