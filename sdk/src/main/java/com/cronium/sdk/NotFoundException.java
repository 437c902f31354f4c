package com.cronium.sdk;

/** The requested input, output, context or variable does not exist. */
public class NotFoundException extends CroniumException {

    public NotFoundException(String message) {
        super(message, 404, "NotFound", null);
    }
}
