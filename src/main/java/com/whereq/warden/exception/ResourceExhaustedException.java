package com.whereq.warden.exception;

/**
 * Exception thrown when no connection handle became available within the wait ceiling
 */
public class ResourceExhaustedException extends WardenException {
    public ResourceExhaustedException(String message) {
        super(message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
