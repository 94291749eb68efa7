package com.example.logfilter.filter.strategy;

import com.example.logfilter.filter.models.CriterionValue;
import com.example.logfilter.filter.models.FilterOperator;

/**
 * Predicate bound to one field and one operator of a record type.
 *
 * <p>Implementations keep no per-record state. The only mutable state they may
 * touch is the shared {@link RegexPatternCache}, which is safe for concurrent use.
 *
 * @param <T> record type the strategy is evaluated against
 */
public interface FieldStrategy<T> {

    String fieldName();

    FilterOperator operator();

    /**
     * Checks type and format of a literal before any record is evaluated.
     */
    boolean isValidValue(CriterionValue value);

    /**
     * Tests one record. A missing or empty field never matches, whatever the
     * operator, and absent data never raises an exception.
     */
    boolean matches(T record, CriterionValue value);

    /**
     * Heuristic fraction of records expected to match, in {@code [0, 1]}.
     * Lower means more selective.
     */
    double estimateSelectivity(CriterionValue value);
}
