package com.cronium.sdk;

/** The token is valid but was issued for a different execution. */
public class UnauthorizedException extends CroniumException {

    public UnauthorizedException(String message) {
        super(message, 403, "Unauthorized", null);
    }
}
