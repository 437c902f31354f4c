package com.cronium.runtime.error;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by every handler and filter.
 *
 * The wire name is what clients see in the {@code error} field of the
 * envelope; SDKs map it 1:1 to a typed exception.
 */
public enum ErrorCode {

    UNAUTHENTICATED   ("Unauthenticated",  HttpStatus.UNAUTHORIZED),
    UNAUTHORIZED      ("Unauthorized",     HttpStatus.FORBIDDEN),
    INVALID_REQUEST   ("InvalidRequest",   HttpStatus.BAD_REQUEST),
    NOT_FOUND         ("NotFound",         HttpStatus.NOT_FOUND),
    RATE_LIMITED      ("RateLimited",      HttpStatus.TOO_MANY_REQUESTS),
    UNAVAILABLE       ("Unavailable",      HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL          ("Internal",         HttpStatus.INTERNAL_SERVER_ERROR),
    // Tool subsystem ran the action and reported failure.
    TOOL_ACTION_FAILED("ToolActionFailed", HttpStatus.UNPROCESSABLE_ENTITY),
    // Tool subsystem did not answer in time; the action may or may not have happened.
    DEADLINE_EXCEEDED ("DeadlineExceeded", HttpStatus.GATEWAY_TIMEOUT);

    private final String     wireName;
    private final HttpStatus status;

    ErrorCode(String wireName, HttpStatus status) {
        this.wireName = wireName;
        this.status   = status;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public HttpStatus status() { return status; }
}
