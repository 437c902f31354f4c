package com.cronium.sdk;

/** The Runtime API rejected the request as malformed, for example an illegal variable key. */
public class InvalidRequestException extends CroniumException {

    public InvalidRequestException(String message) {
        super(message, 400, "InvalidRequest", null);
    }
}
