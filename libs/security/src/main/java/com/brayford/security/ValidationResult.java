package com.brayford.security;

import java.util.List;

/**
 * Outcome of validating a value: either valid (no errors) or invalid with every problem found.
 *
 * @param valid  whether all checks passed
 * @param errors human-readable error messages (empty if valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Creates a passing result. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /** Throws {@link IllegalArgumentException} listing every error if this result is invalid. */
    public void orThrow() {
        if (!valid) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }
    }
}
