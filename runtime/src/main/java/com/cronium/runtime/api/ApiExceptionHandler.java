package com.cronium.runtime.api;

import com.cronium.runtime.api.dto.ApiResponse;
import com.cronium.runtime.error.ApiException;
import com.cronium.runtime.error.ErrorCode;
import com.cronium.runtime.store.StateStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Turns every exception escaping a controller into the response envelope.
 * Internal details never reach the client; they go to the log instead.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException ex) {
        return envelope(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(StateStoreUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleStoreUnavailable(StateStoreUnavailableException ex) {
        log.warn("State store unavailable: {}", ex.getMessage());
        return envelope(ErrorCode.UNAVAILABLE, "State store temporarily unavailable");
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception ex) {
        log.debug("Rejected malformed request: {}", ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
                ? "Request body is missing or is not valid JSON"
                : ex.getMessage();
        return envelope(ErrorCode.INVALID_REQUEST, message);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ApiResponse<Void>> handleNoRoute(Exception ex) {
        return envelope(ErrorCode.NOT_FOUND, "No such route");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        log.error("Unhandled exception", ex);
        return envelope(ErrorCode.INTERNAL, "An unexpected error occurred");
    }

    private static ResponseEntity<ApiResponse<Void>> envelope(ErrorCode code, String message) {
        return ResponseEntity.status(code.status()).body(ApiResponse.failure(code, message));
    }
}
