package com.familyledger.exception;

public class DuplicateRelationshipException extends FamilyLedgerException {

    private final long existingId;

    public DuplicateRelationshipException(long existingId) {
        super("Relationship " + existingId + " already links these people with this type over an overlapping period");
        this.existingId = existingId;
    }

    public long getExistingId() {
        return existingId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DUPLICATE_RELATIONSHIP;
    }
}
