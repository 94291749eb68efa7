package com.example.logfilter.filter.models;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators understood by the field strategies.
 */
public enum FilterOperator {
    EQUALS("equals"),
    NOT_EQUALS("notequals"),
    CONTAINS("contains"),
    NOT_CONTAINS("notcontains"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith"),
    IN("in"),
    NOT_IN("notin"),
    REGEX("regex"),
    GREATER_THAN("greaterthan"),
    LESS_THAN("lessthan"),
    GREATER_THAN_OR_EQUAL("greaterthanorequal"),
    LESS_THAN_OR_EQUAL("lessthanorequal"),
    BETWEEN("between");

    private final String operatorName;

    FilterOperator(String operatorName) {
        this.operatorName = operatorName;
    }

    public String operatorName() {
        return operatorName;
    }

    public boolean isNegated() {
        return this == NOT_EQUALS || this == NOT_CONTAINS || this == NOT_IN;
    }

    /**
     * The non-negated counterpart, or this operator when it is not a negation.
     */
    public FilterOperator positive() {
        return switch (this) {
            case NOT_EQUALS -> EQUALS;
            case NOT_CONTAINS -> CONTAINS;
            case NOT_IN -> IN;
            default -> this;
        };
    }

    /**
     * Resolves a user supplied operator name. Case, spaces, dashes and
     * underscores are ignored, so {@code "Not Equals"} resolves to
     * {@link #NOT_EQUALS}.
     */
    public static Optional<FilterOperator> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.replaceAll("[\\s_\\-]", "").toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(op -> op.operatorName.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return operatorName;
    }
}
