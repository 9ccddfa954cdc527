package com.payproc.adapter.in.csv;

import java.util.List;

/**
 * Outcome of checking one CSV record; {@code errors} is empty when the record is valid
 */
public record ValidationResult(List<String> errors) {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * All errors in one line, used as the parse failure reason
     */
    public String describe() {
        return String.join("; ", errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(List<String> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("an invalid result needs at least one error");
        }
        return new ValidationResult(errors);
    }
}
