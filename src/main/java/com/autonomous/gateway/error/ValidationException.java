package com.autonomous.gateway.error;

import java.util.List;

/** Caller input was rejected; {@link #getErrors()} lists every reason. */
public class ValidationException extends AIException {

    private final List<String> errors;

    public ValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
