package com.familyledger.exception;

/**
 * Base of all domain errors. These are caused by caller input or concurrent state and are
 * never retried.
 */
public abstract class FamilyLedgerException extends RuntimeException {

    protected FamilyLedgerException(String message) {
        super(message);
    }

    public abstract ErrorKind kind();

    public String code() {
        return kind().code();
    }
}
