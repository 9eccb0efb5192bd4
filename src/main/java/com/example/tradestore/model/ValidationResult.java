package com.example.tradestore.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a validation call. {@code success} is true iff {@code errors} is empty.
 */
public record ValidationResult(
        boolean success,
        List<String> errors,
        List<String> warnings,
        TradeType tradeType
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        success = errors.isEmpty();
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), List.of(), null);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, null);
    }

    public static ValidationResult failure(String error) {
        return new ValidationResult(false, List.of(error), List.of(), null);
    }

    public static ValidationResult warning(String warning) {
        return new ValidationResult(true, List.of(), List.of(warning), null);
    }

    public ValidationResult withTradeType(TradeType type) {
        return new ValidationResult(success, errors, warnings, type);
    }

    /**
     * Union of both results; errors and warnings keep their order.
     */
    public ValidationResult merge(ValidationResult other) {
        List<String> allErrors = new ArrayList<>(errors);
        allErrors.addAll(other.errors());
        List<String> allWarnings = new ArrayList<>(warnings);
        allWarnings.addAll(other.warnings());
        return new ValidationResult(allErrors.isEmpty(), allErrors, allWarnings,
                tradeType != null ? tradeType : other.tradeType());
    }
}
