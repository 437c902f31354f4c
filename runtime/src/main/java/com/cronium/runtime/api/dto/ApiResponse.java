package com.cronium.runtime.api.dto;

import com.cronium.runtime.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Uniform response envelope for every route.
 *
 * Success: {"success": true, "data": ...}
 * Failure: {"success": false, "error": "NotFound", "message": "..."}
 *
 * retryAfterSeconds is only present on RateLimited responses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean   success,
        T         data,
        ErrorCode error,
        String    message,
        Object    metadata,
        Long      retryAfterSeconds
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null, null, null);
    }

    public static <T> ApiResponse<T> ok(T data, Object metadata) {
        return new ApiResponse<>(true, data, null, null, metadata, null);
    }

    /** Acknowledgement for writes: {"success": true}. */
    public static ApiResponse<Void> ok() {
        return new ApiResponse<>(true, null, null, null, null, null);
    }

    public static ApiResponse<Void> failure(ErrorCode error, String message) {
        return new ApiResponse<>(false, null, error, message, null, null);
    }

    public static ApiResponse<Void> rateLimited(String message, long retryAfterSeconds) {
        return new ApiResponse<>(false, null, ErrorCode.RATE_LIMITED, message, null, retryAfterSeconds);
    }
}
