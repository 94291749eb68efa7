package com.example.logfilter.filter.strategy;

import com.example.logfilter.filter.models.CriterionValue;
import com.example.logfilter.filter.models.DateRangeValue;
import com.example.logfilter.filter.models.FilterOperator;
import com.example.logfilter.filter.models.TextSetValue;
import com.example.logfilter.filter.models.TextValue;
import com.example.logfilter.logs.TimestampParser;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Instant comparisons. Literals are ISO-8601 text; {@code between} takes an
 * inclusive {@link DateRangeValue} or a two-element set of timestamps.
 */
public class TimestampFieldStrategy<T> extends AbstractFieldStrategy<T, Instant> {

    public static final Set<FilterOperator> OPERATORS = EnumSet.of(
            FilterOperator.EQUALS, FilterOperator.NOT_EQUALS,
            FilterOperator.GREATER_THAN, FilterOperator.LESS_THAN,
            FilterOperator.GREATER_THAN_OR_EQUAL, FilterOperator.LESS_THAN_OR_EQUAL,
            FilterOperator.BETWEEN);

    public TimestampFieldStrategy(String fieldName, FilterOperator operator, Function<T, Instant> accessor) {
        super(fieldName, operator, accessor, SelectivityProfile.TIMESTAMP);
    }

    @Override
    protected Set<FilterOperator> supportedOperators() {
        return OPERATORS;
    }

    @Override
    public boolean isValidValue(CriterionValue value) {
        if (operator() == FilterOperator.BETWEEN) {
            return toRange(value).filter(DateRangeValue::isWellFormed).isPresent();
        }
        return toInstant(value).isPresent();
    }

    @Override
    protected boolean matchesPositive(FilterOperator operator, Instant fieldValue, CriterionValue value) {
        if (operator == FilterOperator.BETWEEN) {
            return toRange(value).map(range -> range.contains(fieldValue)).orElse(false);
        }
        Optional<Instant> literal = toInstant(value);
        if (literal.isEmpty()) {
            return false;
        }
        int comparison = fieldValue.compareTo(literal.get());
        return switch (operator) {
            case EQUALS -> comparison == 0;
            case GREATER_THAN -> comparison > 0;
            case LESS_THAN -> comparison < 0;
            case GREATER_THAN_OR_EQUAL -> comparison >= 0;
            case LESS_THAN_OR_EQUAL -> comparison <= 0;
            default -> false;
        };
    }

    private static Optional<Instant> toInstant(CriterionValue value) {
        if (value instanceof TextValue text) {
            return TimestampParser.parse(text.text());
        }
        return Optional.empty();
    }

    private static Optional<DateRangeValue> toRange(CriterionValue value) {
        if (value instanceof DateRangeValue range) {
            return Optional.of(range);
        }
        if (value instanceof TextSetValue set && set.values().size() == 2) {
            Optional<Instant> from = TimestampParser.parse(set.values().get(0));
            Optional<Instant> to = TimestampParser.parse(set.values().get(1));
            if (from.isPresent() && to.isPresent()) {
                return Optional.of(new DateRangeValue(from.get(), to.get()));
            }
        }
        return Optional.empty();
    }
}
