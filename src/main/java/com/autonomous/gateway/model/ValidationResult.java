package com.autonomous.gateway.model;

import java.util.List;

public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = List.copyOf(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(List<String> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one reason");
        }
        return new ValidationResult(errors);
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return isValid() ? "Valid" : "Invalid" + errors;
    }
}
