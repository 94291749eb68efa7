package com.example.logfilter.filter.models;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ValidationError(
        @JsonProperty("criterionIndex") int criterionIndex,
        @JsonProperty("field") String field,
        @JsonProperty("reason") String reason
) {
    @Override
    public String toString() {
        return "criterion[" + criterionIndex + "] " + reason;
    }
}
