package com.example.logfilter.filter.strategy;

import com.example.logfilter.filter.models.CriterionValue;
import com.example.logfilter.filter.models.FilterOperator;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Shared plumbing for strategies: field extraction, missing-value handling,
 * operator negation and selectivity lookup.
 *
 * @param <T> record type
 * @param <V> type of the extracted field value
 */
public abstract class AbstractFieldStrategy<T, V> implements FieldStrategy<T> {

    private final String fieldName;
    private final FilterOperator operator;
    private final Function<T, V> accessor;
    private final SelectivityProfile selectivityProfile;

    protected AbstractFieldStrategy(String fieldName,
                                    FilterOperator operator,
                                    Function<T, V> accessor,
                                    SelectivityProfile selectivityProfile) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        this.selectivityProfile = Objects.requireNonNull(selectivityProfile, "selectivityProfile");

        if (!supportedOperators().contains(operator)) {
            throw new IllegalArgumentException(
                    "Operator '" + operator + "' is not applicable to field " + fieldName);
        }
    }

    /**
     * Operators this family of strategies knows how to evaluate.
     */
    protected abstract Set<FilterOperator> supportedOperators();

    /**
     * Evaluates the non-negated form of {@code operator} against a present field value.
     */
    protected abstract boolean matchesPositive(FilterOperator operator, V fieldValue, CriterionValue value);

    protected boolean isMissing(V fieldValue) {
        return fieldValue == null;
    }

    @Override
    public String fieldName() {
        return fieldName;
    }

    @Override
    public FilterOperator operator() {
        return operator;
    }

    @Override
    public boolean matches(T record, CriterionValue value) {
        if (record == null || value == null) {
            return false;
        }
        V fieldValue = accessor.apply(record);
        if (isMissing(fieldValue)) {
            return false;
        }
        boolean positive = matchesPositive(operator.positive(), fieldValue, value);
        return operator.isNegated() != positive;
    }

    @Override
    public double estimateSelectivity(CriterionValue value) {
        return selectivityProfile.estimate(operator, value);
    }

    @Override
    public String toString() {
        return fieldName + " " + operator;
    }
}
