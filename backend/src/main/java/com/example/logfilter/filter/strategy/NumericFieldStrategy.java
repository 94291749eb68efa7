package com.example.logfilter.filter.strategy;

import com.example.logfilter.filter.models.CriterionValue;
import com.example.logfilter.filter.models.FilterOperator;
import com.example.logfilter.filter.models.NumberValue;
import com.example.logfilter.filter.models.TextSetValue;
import com.example.logfilter.filter.models.TextValue;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Numeric comparisons by value, so {@code 200} equals {@code 200.0}. Literals
 * may be a {@link NumberValue} or numeric text.
 */
public class NumericFieldStrategy<T> extends AbstractFieldStrategy<T, Number> {

    public static final Set<FilterOperator> OPERATORS = EnumSet.of(
            FilterOperator.EQUALS, FilterOperator.NOT_EQUALS,
            FilterOperator.GREATER_THAN, FilterOperator.LESS_THAN,
            FilterOperator.GREATER_THAN_OR_EQUAL, FilterOperator.LESS_THAN_OR_EQUAL,
            FilterOperator.IN, FilterOperator.NOT_IN);

    public NumericFieldStrategy(String fieldName, FilterOperator operator, Function<T, Number> accessor) {
        super(fieldName, operator, accessor, SelectivityProfile.NUMERIC);
    }

    @Override
    protected Set<FilterOperator> supportedOperators() {
        return OPERATORS;
    }

    @Override
    public boolean isValidValue(CriterionValue value) {
        if (operator() == FilterOperator.IN || operator() == FilterOperator.NOT_IN) {
            if (value instanceof TextSetValue set) {
                return !set.values().isEmpty()
                        && set.values().stream().allMatch(v -> parse(v).isPresent());
            }
        }
        return toNumber(value).isPresent();
    }

    @Override
    protected boolean matchesPositive(FilterOperator operator, Number fieldValue, CriterionValue value) {
        Optional<BigDecimal> actual = parse(fieldValue.toString());
        if (actual.isEmpty()) {
            return false;
        }
        if (operator == FilterOperator.IN) {
            return literals(value).stream().anyMatch(literal -> actual.get().compareTo(literal) == 0);
        }
        Optional<BigDecimal> literal = toNumber(value);
        if (literal.isEmpty()) {
            return false;
        }
        int comparison = actual.get().compareTo(literal.get());
        return switch (operator) {
            case EQUALS -> comparison == 0;
            case GREATER_THAN -> comparison > 0;
            case LESS_THAN -> comparison < 0;
            case GREATER_THAN_OR_EQUAL -> comparison >= 0;
            case LESS_THAN_OR_EQUAL -> comparison <= 0;
            default -> false;
        };
    }

    private static List<BigDecimal> literals(CriterionValue value) {
        if (value instanceof TextSetValue set) {
            return set.values().stream()
                    .map(NumericFieldStrategy::parse)
                    .flatMap(Optional::stream)
                    .toList();
        }
        return toNumber(value).map(List::of).orElse(List.of());
    }

    private static Optional<BigDecimal> toNumber(CriterionValue value) {
        if (value instanceof NumberValue number) {
            return Optional.ofNullable(number.number());
        }
        if (value instanceof TextValue text) {
            return parse(text.text());
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
