package com.familyledger.exception;

/**
 * Storage kept failing after the bounded local retries. Not a domain error: the caller may
 * retry the whole request later.
 */
public class StorageUnavailableException extends RuntimeException {

    public static final String CODE = "storage_unavailable";

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
