package com.familyledger.exception;

public class InvalidRelationshipException extends FamilyLedgerException {

    public InvalidRelationshipException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_RELATIONSHIP;
    }
}
