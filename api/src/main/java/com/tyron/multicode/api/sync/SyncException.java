package com.tyron.multicode.api.sync;

import com.tyron.multicode.api.meta.ValidationError;

import java.util.List;

/**
 * A message could not be applied. The engine state is left as it was before the message.
 */
public class SyncException extends Exception {

    private final List<ValidationError> errors;

    public SyncException(String message) {
        this(message, List.of());
    }

    public SyncException(String message, List<ValidationError> errors) {
        super(errors.isEmpty() ? message : message + ": " + errors);
        this.errors = List.copyOf(errors);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
