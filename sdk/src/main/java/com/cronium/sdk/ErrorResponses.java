package com.cronium.sdk;

import java.time.Duration;

/** Maps a failed Runtime API response onto the exception hierarchy. */
final class ErrorResponses {

    private ErrorResponses() {}

    /**
     * @param status     HTTP status of the response
     * @param errorCode  "error" field of the envelope, may be null
     * @param message    "message" field of the envelope, may be null
     * @param retryAfter server retry hint, may be null
     */
    static CroniumException toException(int status, String errorCode, String message, Duration retryAfter) {
        String text = message == null || message.isBlank() ? "HTTP " + status : message;
        if (errorCode != null) {
            switch (errorCode) {
                case "Unauthenticated":  return new UnauthenticatedException(text);
                case "Unauthorized":     return new UnauthorizedException(text);
                case "InvalidRequest":   return new InvalidRequestException(text);
                case "NotFound":         return new NotFoundException(text);
                case "RateLimited":      return new RateLimitedException(text, retryAfter);
                case "Unavailable":      return new UnavailableException(text, status, null);
                case "Internal":         return new InternalErrorException(text, status);
                case "ToolActionFailed": return new ToolActionFailedException(text);
                case "DeadlineExceeded": return new CroniumTimeoutException(text, status, null);
                default: break;
            }
        }
        return switch (status) {
            case 400 -> new InvalidRequestException(text);
            case 401 -> new UnauthenticatedException(text);
            case 403 -> new UnauthorizedException(text);
            case 404 -> new NotFoundException(text);
            case 422 -> new ToolActionFailedException(text);
            case 429 -> new RateLimitedException(text, retryAfter);
            case 502, 503 -> new UnavailableException(text, status, null);
            case 504 -> new CroniumTimeoutException(text, status, null);
            default -> new InternalErrorException(text, status);
        };
    }
}
