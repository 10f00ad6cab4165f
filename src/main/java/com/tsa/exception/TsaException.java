package com.tsa.exception;

/**
 * Base exception for the condition analysis framework.
 */
public class TsaException extends RuntimeException {

    public TsaException(String message) {
        super(message);
    }

    public TsaException(String message, Throwable cause) {
        super(message, cause);
    }
}
