package com.example.logfilter.filter.models;

import java.time.Instant;

/**
 * Inclusive timestamp range.
 */
public record DateRangeValue(Instant from, Instant to) implements CriterionValue {

    public boolean isWellFormed() {
        return from != null && to != null && !from.isAfter(to);
    }

    public boolean contains(Instant instant) {
        return isWellFormed() && !instant.isBefore(from) && !instant.isAfter(to);
    }

    @Override
    public String display() {
        return "[" + from + " .. " + to + "]";
    }
}
