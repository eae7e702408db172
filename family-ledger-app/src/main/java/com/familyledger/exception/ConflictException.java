package com.familyledger.exception;

public class ConflictException extends FamilyLedgerException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }
}
