package com.whereq.warden.exception;

/**
 * Base class for errors raised by the execution engine instead of being recorded as results
 */
public class WardenException extends RuntimeException {
    public WardenException(String message) {
        super(message);
    }

    public WardenException(String message, Throwable cause) {
        super(message, cause);
    }
}
