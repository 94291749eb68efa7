package com.example.logfilter.filter.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One user supplied {@code (field, operator, value)} condition.
 */
public record Criterion(
        @JsonProperty("field") String field,
        @JsonProperty("operator") String operator,
        @JsonProperty("value") CriterionValue value
) {
    public static Criterion of(String field, String operator, CriterionValue value) {
        return new Criterion(field, operator, value);
    }

    @Override
    public String toString() {
        return field + " " + operator + " " + (value == null ? "null" : value.display());
    }
}
