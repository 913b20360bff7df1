package com.jay.finsync.controller;

import com.jay.finsync.layer1_data.FmpException;
import com.jay.finsync.layer1_data.FmpRateLimitException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;

/**
 * Maps sync failures to HTTP responses.
 * Bad symbol, period or limit is the caller's fault (400); FMP trouble is an upstream fault (429/502).
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for '{}': {}", ex.getName(), ex.getValue());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request",
            "Invalid value for parameter '" + ex.getName() + "': " + ex.getValue());
    }

    @ExceptionHandler(FmpRateLimitException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(FmpRateLimitException ex) {
        log.error("FMP rate limit exhausted: {}", ex.getMessage());
        return build(HttpStatus.TOO_MANY_REQUESTS, "Upstream Rate Limit", ex.getMessage());
    }

    @ExceptionHandler(FmpException.class)
    public ResponseEntity<ErrorResponse> handleFmp(FmpException ex) {
        log.error("FMP request failed: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Upstream Error", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: ", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        ErrorResponse body = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(status.value())
            .error(error)
            .message(message)
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
