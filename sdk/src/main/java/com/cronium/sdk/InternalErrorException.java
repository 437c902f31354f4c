package com.cronium.sdk;

/** Unexpected server-side failure, or a response the SDK could not understand. */
public class InternalErrorException extends CroniumException {

    public InternalErrorException(String message, int statusCode) {
        super(message, statusCode, "Internal", null);
    }
}
