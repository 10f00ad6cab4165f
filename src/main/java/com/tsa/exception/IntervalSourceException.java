package com.tsa.exception;

/**
 * Exception thrown when validity intervals cannot be retrieved or are inconsistent.
 */
public class IntervalSourceException extends TsaException {

    public IntervalSourceException(String message) {
        super(message);
    }

    public IntervalSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
