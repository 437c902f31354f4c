package com.cronium.sdk;

/** The execution token is missing, malformed, tampered with or expired. */
public class UnauthenticatedException extends CroniumException {

    public UnauthenticatedException(String message) {
        super(message, 401, "Unauthenticated", null);
    }
}
