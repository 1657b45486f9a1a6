package com.capacityengine.api.controller;

import com.capacityengine.common.exception.CapacityEngineException;
import com.capacityengine.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CapacityEngineException.class)
    public ResponseEntity<Map<String, String>> handleEngineException(CapacityEngineException e) {
        HttpStatus status = statusFor(e.getCode());
        if (e.isFatal()) {
            log.error("Fatal engine error", e);
        } else {
            log.debug("Request failed with {}: {}", e.getCode(), e.getMessage());
        }
        Map<String, String> body = buildErrorBody(status, e.getMessage());
        body.put("code", e.getCode().name());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(buildErrorBody(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(buildErrorBody(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + e.getMessage()));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case BAD_ORIGIN -> HttpStatus.FORBIDDEN;
            case BIDDING_CLOSED, BIDDING_OPEN, ALREADY_CLAIMED, NOT_LOCK_BACKED -> HttpStatus.CONFLICT;
            case SUBSCRIPTION_EXPIRED, QUOTA_EXHAUSTED -> HttpStatus.TOO_MANY_REQUESTS;
            case CLOCK_REGRESSION -> HttpStatus.INTERNAL_SERVER_ERROR;
            case BID_TOO_LOW, INVALID_AMOUNT, INSUFFICIENT_BALANCE -> HttpStatus.BAD_REQUEST;
        };
    }

    private Map<String, String> buildErrorBody(HttpStatus status, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        error.put("status", String.valueOf(status.value()));
        return error;
    }
}
