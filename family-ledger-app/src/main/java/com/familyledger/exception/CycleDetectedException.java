package com.familyledger.exception;

public class CycleDetectedException extends FamilyLedgerException {

    private final long parentId;
    private final long childId;

    public CycleDetectedException(long parentId, long childId) {
        super("Person " + parentId + " cannot be a parent of " + childId + ": " + parentId
            + " is already a descendant of " + childId);
        this.parentId = parentId;
        this.childId = childId;
    }

    public long getParentId() {
        return parentId;
    }

    public long getChildId() {
        return childId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CYCLE_DETECTED;
    }
}
