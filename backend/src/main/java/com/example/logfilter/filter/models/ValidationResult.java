package com.example.logfilter.filter.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of validating a list of criteria. Holds every problem found, not
 * just the first one.
 */
public record ValidationResult(
        @JsonProperty("errors") List<ValidationError> errors
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult success() {
        return new ValidationResult(List.of());
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationError> errorsFor(int criterionIndex) {
        return errors.stream()
                .filter(error -> error.criterionIndex() == criterionIndex)
                .toList();
    }

    @Override
    public String toString() {
        if (isValid()) {
            return "Validation successful";
        }
        return "FAILED with " + errors.size() + " error(s): " + errors;
    }
}
