package com.familyledger.exception;

public class NotFoundException extends FamilyLedgerException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
