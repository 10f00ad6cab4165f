package com.tsa.exception;

/**
 * Exception thrown when an analysis definition is invalid.
 * Results in fail-fast when loading.
 */
public class ConfigurationException extends TsaException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
