package com.tsa.error;

import java.util.Objects;

/**
 * One entry of the error report.
 *
 * @param scope   Condition id string, or collection title for cross-cutting errors
 * @param kind    Error category
 * @param level   Severity
 * @param message Human-readable description
 */
public record TsaError(String scope, ErrorKind kind, ErrorKind.Level level, String message) {

    public TsaError {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
    }

    public static TsaError of(String scope, ErrorKind kind, String message) {
        return new TsaError(scope, kind, kind.defaultLevel(), message);
    }

    public boolean isError() {
        return level == ErrorKind.Level.ERROR;
    }

    @Override
    public String toString() {
        return level + " <" + scope + "> " + kind.displayName() + ": " + message;
    }
}
