package com.koni.uns.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating a configuration: a validity flag plus error and warning messages.
 * Errors make the result invalid; warnings are informational.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ValidationResult {

    private final List<String> errors;
    private final List<String> warnings;

    public ValidationResult(List<String> errors, List<String> warnings) {
        this.errors = errors == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = warnings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static ValidationResult success() {
        return new ValidationResult(List.of(), List.of());
    }

    public static ValidationResult failure(String... errors) {
        return new ValidationResult(List.of(errors), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Joins all errors into a single human-readable message.
     */
    public String getErrorMessage() {
        return String.join("; ", errors);
    }
}
