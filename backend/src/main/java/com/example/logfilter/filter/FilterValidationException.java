package com.example.logfilter.filter;

import com.example.logfilter.filter.models.ValidationResult;

/**
 * Raised when a filter is asked to run with criteria that failed validation.
 */
public class FilterValidationException extends RuntimeException {

    private final ValidationResult validationResult;

    public FilterValidationException(ValidationResult validationResult) {
        super("Invalid filter criteria: " + validationResult.errors());
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
