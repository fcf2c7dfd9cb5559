package com.arbiter.exception;

/**
 * Exception thrown when configuration is invalid or contains unknown keys.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends ArbiterException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
