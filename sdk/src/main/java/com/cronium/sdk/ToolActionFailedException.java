package com.cronium.sdk;

/**
 * The tool action ran and the tool reported a failure (bad channel, rejected
 * recipient, revoked credentials). Repeating the call will not help.
 */
public class ToolActionFailedException extends CroniumException {

    public ToolActionFailedException(String message) {
        super(message, 422, "ToolActionFailed", null);
    }
}
