package com.tsa.exception;

/**
 * Exception thrown when a free-text name cannot be turned into a safe identifier.
 */
public class InvalidIdentifierException extends TsaException {

    private final String original;
    private final int position;

    public InvalidIdentifierException(String message, String original, int position) {
        super(message);
        this.original = original;
        this.position = position;
    }

    /**
     * The input as it was given, surrounding whitespace included.
     */
    public String getOriginal() {
        return original;
    }

    /**
     * Position of the offending character in {@link #getOriginal()}, or -1 if
     * the whole string is at fault.
     */
    public int getPosition() {
        return position;
    }
}
