package com.example.logfilter.filter.expression;

import com.example.logfilter.filter.models.CriterionValue;
import com.example.logfilter.filter.strategy.FieldStrategy;

import java.util.Objects;

/**
 * A strategy bound to its literal. The literal is checked once, here, so that
 * evaluation never sees a malformed value.
 */
public final class FilterLeaf<T> implements FilterExpression<T> {

    private final FieldStrategy<T> strategy;
    private final CriterionValue value;

    public FilterLeaf(FieldStrategy<T> strategy, CriterionValue value) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        if (value == null || !strategy.isValidValue(value)) {
            throw new IllegalArgumentException("Invalid value '" + (value == null ? null : value.display())
                    + "' for " + strategy.fieldName() + " " + strategy.operator());
        }
        this.value = value;
    }

    public FieldStrategy<T> strategy() {
        return strategy;
    }

    public CriterionValue value() {
        return value;
    }

    @Override
    public boolean matches(T record) {
        return strategy.matches(record, value);
    }

    @Override
    public String description() {
        return strategy.fieldName() + " " + strategy.operator() + " " + value.display();
    }

    @Override
    public double estimatedSelectivity() {
        return strategy.estimateSelectivity(value);
    }

    @Override
    public String toString() {
        return description();
    }
}
