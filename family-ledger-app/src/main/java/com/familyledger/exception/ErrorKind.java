package com.familyledger.exception;

/**
 * Domain error kinds. Codes are part of the API contract and must not change.
 */
public enum ErrorKind {
    NOT_FOUND("not_found"),
    INVALID_RELATIONSHIP("invalid_relationship"),
    CYCLE_DETECTED("cycle_detected"),
    DUPLICATE_RELATIONSHIP("duplicate_relationship"),
    CONFLICT("conflict"),
    FORBIDDEN("forbidden"),
    VALIDATION_ERROR("validation_error");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
