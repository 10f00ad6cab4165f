package com.tsa.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, duplicate-free list of errors belonging to one scope.
 * Repeated messages from loops are collapsed into one entry.
 */
public class ErrorCollection {

    private static final Logger log = LoggerFactory.getLogger(ErrorCollection.class);

    private final String scope;
    private final List<TsaError> errors = new ArrayList<>();

    public ErrorCollection(String scope) {
        this.scope = scope;
    }

    public String getScope() {
        return scope;
    }

    /**
     * Add an error with the kind's default level.
     *
     * @return true if the error was new in this collection
     */
    public boolean add(ErrorKind kind, String message) {
        return add(new TsaError(scope, kind, kind.defaultLevel(), message));
    }

    public boolean add(TsaError error) {
        if (errors.contains(error)) {
            return false;
        }
        errors.add(error);
        log.debug("Recorded {}", error);
        return true;
    }

    /**
     * @return true if the error was present
     */
    public boolean remove(TsaError error) {
        return errors.remove(error);
    }

    public List<TsaError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return errors.stream().anyMatch(TsaError::isError);
    }

    public boolean contains(ErrorKind kind) {
        return errors.stream().anyMatch(e -> e.kind() == kind);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }
}
