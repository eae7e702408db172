package com.familyledger.controller;

import com.familyledger.exception.FamilyLedgerException;
import com.familyledger.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps engine errors to responses carrying their stable error code.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(FamilyLedgerException.class)
    public ResponseEntity<Map<String, Object>> handleDomainError(FamilyLedgerException e) {
        return ResponseEntity.status(statusFor(e)).body(body(e.code(), e.getMessage()));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStorageUnavailable(StorageUnavailableException e) {
        log.error("Storage unavailable", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(body(StorageUnavailableException.CODE, "Storage is temporarily unavailable"));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception e) {
        return ResponseEntity.badRequest().body(body("validation_error", e.getMessage()));
    }

    static HttpStatus statusFor(FamilyLedgerException e) {
        return switch (e.kind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_RELATIONSHIP -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CYCLE_DETECTED, DUPLICATE_RELATIONSHIP, CONFLICT -> HttpStatus.CONFLICT;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
        };
    }

    private static Map<String, Object> body(String code, String message) {
        return Map.of("error", code, "message", message != null ? message : code);
    }
}
