package org.dxworks.clippy.validation;

import java.util.List;

/**
 * Outcome of a validation run. Errors make the content invalid; warnings only report
 * limits that were exceeded or values that look suspicious.
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors, warnings);
    }

    public static ValidationResult invalid(String error) {
        return of(List.of(error), List.of());
    }
}
