package com.fieldservice.scheduling.controller;

import com.fieldservice.scheduling.exception.NotFoundException;
import com.fieldservice.scheduling.exception.SchedulingException;
import com.fieldservice.scheduling.exception.ServiceUnavailableException;
import com.fieldservice.shared.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps scheduling failures onto the shared {@link ApiResponse} error envelope:
 * not found → 404, unavailable → 503, other domain and argument errors → 400.
 */
@Slf4j
@RestControllerAdvice
public class SchedulingExceptionHandler {

    static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(NotFoundException ex) {
        log.warn("Not found [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnavailable(ServiceUnavailableException ex) {
        log.warn("Unavailable [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<ApiResponse<Void>> handleSchedulingException(SchedulingException ex) {
        log.warn("Scheduling error [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(INVALID_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadParameter(Exception ex) {
        log.warn("Invalid request parameter: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(INVALID_REQUEST, ex.getMessage()));
    }
}
