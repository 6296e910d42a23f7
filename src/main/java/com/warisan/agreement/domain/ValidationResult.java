package com.warisan.agreement.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collected outcome of a validation run. Errors block the operation, warnings never do.
 */
public record ValidationResult(
    boolean valid,
    List<String> errors,
    List<String> warnings
) {
    public ValidationResult {
        errors = List.copyOf(Objects.requireNonNullElse(errors, Collections.emptyList()));
        warnings = List.copyOf(Objects.requireNonNullElse(warnings, Collections.emptyList()));
        valid = errors.isEmpty();
    }

    public static ValidationResult success() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    public static ValidationResult error(String message) {
        return of(List.of(message), List.of());
    }

    /**
     * Combine two results, keeping every error and warning in order.
     */
    public ValidationResult merge(ValidationResult other) {
        var mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors());
        var mergedWarnings = new ArrayList<>(warnings);
        mergedWarnings.addAll(other.warnings());
        return of(mergedErrors, mergedWarnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
