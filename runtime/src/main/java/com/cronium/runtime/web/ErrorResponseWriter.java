package com.cronium.runtime.web;

import com.cronium.runtime.api.dto.ApiResponse;
import com.cronium.runtime.error.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes the error envelope from servlet filters, where the controller
 * advice is not in play.
 */
@Component
public class ErrorResponseWriter {

    private final ObjectMapper json;

    public ErrorResponseWriter(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public void write(HttpServletResponse response, ErrorCode code, String message) throws IOException {
        write(response, code.status().value(), ApiResponse.failure(code, message));
    }

    /** 429 with a Retry-After header and the same hint in the body. */
    public void writeRateLimited(HttpServletResponse response, String message, long retryAfterSeconds)
            throws IOException {
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        write(response, ErrorCode.RATE_LIMITED.status().value(),
                ApiResponse.rateLimited(message, retryAfterSeconds));
    }

    private void write(HttpServletResponse response, int status, ApiResponse<?> body) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        json.writeValue(response.getOutputStream(), body);
    }
}
