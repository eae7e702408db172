package com.familyledger.exception;

public class ForbiddenException extends FamilyLedgerException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FORBIDDEN;
    }
}
