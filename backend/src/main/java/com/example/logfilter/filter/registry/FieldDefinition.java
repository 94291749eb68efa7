package com.example.logfilter.filter.registry;

import com.example.logfilter.filter.models.FilterOperator;
import com.example.logfilter.filter.strategy.FieldStrategy;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * One filterable field: its canonical name, the operators it accepts and how
 * to build a strategy for each of them.
 */
public record FieldDefinition<T>(
        String name,
        Set<FilterOperator> operators,
        Function<FilterOperator, FieldStrategy<T>> strategyFactory
) {
    public FieldDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(strategyFactory, "strategyFactory");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be blank");
        }
        if (operators == null || operators.isEmpty()) {
            throw new IllegalArgumentException("Field " + name + " needs at least one operator");
        }
        operators = Collections.unmodifiableSet(EnumSet.copyOf(operators));
    }

    public boolean supports(FilterOperator operator) {
        return operators.contains(operator);
    }

    public FieldStrategy<T> createStrategy(FilterOperator operator) {
        return strategyFactory.apply(operator);
    }
}
