package com.familyledger.exception;

public class ValidationException extends FamilyLedgerException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION_ERROR;
    }
}
