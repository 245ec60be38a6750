package work.lcod.lgx.shared;

import java.util.ArrayList;
import java.util.List;

/**
 * Collected outcome of a validation pass. Problems are accumulated, never short-circuited.
 */
public record ValidationResult(List<String> errors, List<String> warnings) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult ok() {
        return new ValidationResult(List.of(), List.of());
    }

    public static ValidationResult failure(String error) {
        return new ValidationResult(List.of(error), List.of());
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    /**
     * Appends {@code other}'s problems, prefixing each error with {@code errorPrefix}.
     */
    public ValidationResult merge(ValidationResult other, String errorPrefix) {
        List<String> mergedErrors = new ArrayList<>(errors);
        for (String error : other.errors()) {
            mergedErrors.add(errorPrefix + error);
        }
        List<String> mergedWarnings = new ArrayList<>(warnings);
        mergedWarnings.addAll(other.warnings());
        return new ValidationResult(mergedErrors, mergedWarnings);
    }
}
