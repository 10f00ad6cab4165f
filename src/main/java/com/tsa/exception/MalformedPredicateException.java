package com.tsa.exception;

/**
 * Exception thrown when a {@code station#sensor operator value} fragment
 * does not have the expected shape.
 */
public class MalformedPredicateException extends TsaException {

    private final String fragment;

    public MalformedPredicateException(String message, String fragment) {
        super(message + ": " + fragment);
        this.fragment = fragment;
    }

    public String getFragment() {
        return fragment;
    }
}
