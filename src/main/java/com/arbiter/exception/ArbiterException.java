package com.arbiter.exception;

/**
 * Base exception for the arbiter scheduler.
 */
public class ArbiterException extends RuntimeException {

    public ArbiterException(String message) {
        super(message);
    }

    public ArbiterException(String message, Throwable cause) {
        super(message, cause);
    }
}
