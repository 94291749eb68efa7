package com.example.logfilter.filter.strategy;

import com.example.logfilter.filter.models.CriterionValue;
import com.example.logfilter.filter.models.FilterOperator;
import com.example.logfilter.filter.models.TextSetValue;
import com.example.logfilter.filter.models.TextValue;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Case-insensitive string comparisons. Regular expressions are compiled through
 * the shared {@link RegexPatternCache} and matched with {@code find()}.
 */
public class TextFieldStrategy<T> extends AbstractFieldStrategy<T, String> {

    public static final Set<FilterOperator> OPERATORS = EnumSet.of(
            FilterOperator.EQUALS, FilterOperator.NOT_EQUALS,
            FilterOperator.CONTAINS, FilterOperator.NOT_CONTAINS,
            FilterOperator.STARTS_WITH, FilterOperator.ENDS_WITH,
            FilterOperator.IN, FilterOperator.NOT_IN,
            FilterOperator.REGEX);

    private final RegexPatternCache patternCache;

    public TextFieldStrategy(String fieldName,
                             FilterOperator operator,
                             Function<T, String> accessor,
                             SelectivityProfile selectivityProfile,
                             RegexPatternCache patternCache) {
        super(fieldName, operator, accessor, selectivityProfile);
        this.patternCache = Objects.requireNonNull(patternCache, "patternCache");
    }

    @Override
    protected Set<FilterOperator> supportedOperators() {
        return OPERATORS;
    }

    @Override
    protected boolean isMissing(String fieldValue) {
        return fieldValue == null || fieldValue.isEmpty();
    }

    @Override
    public boolean isValidValue(CriterionValue value) {
        switch (operator()) {
            case IN, NOT_IN -> {
                if (value instanceof TextSetValue set) {
                    return !set.values().isEmpty() && set.values().stream().noneMatch(String::isBlank);
                }
                return isNonBlankText(value);
            }
            case REGEX -> {
                return isNonBlankText(value) && patternCache.isValid(((TextValue) value).text());
            }
            default -> {
                return isNonBlankText(value);
            }
        }
    }

    @Override
    protected boolean matchesPositive(FilterOperator operator, String fieldValue, CriterionValue value) {
        if (operator == FilterOperator.IN) {
            return literals(value).stream().anyMatch(fieldValue::equalsIgnoreCase);
        }
        if (!(value instanceof TextValue textValue) || textValue.text() == null) {
            return false;
        }
        String literal = textValue.text();
        return switch (operator) {
            case EQUALS -> fieldValue.equalsIgnoreCase(literal);
            case CONTAINS -> lower(fieldValue).contains(lower(literal));
            case STARTS_WITH -> fieldValue.regionMatches(true, 0, literal, 0, literal.length());
            case ENDS_WITH -> fieldValue.regionMatches(true, fieldValue.length() - literal.length(),
                    literal, 0, literal.length());
            case REGEX -> patternCache.get(literal).matcher(fieldValue).find();
            default -> false;
        };
    }

    private static List<String> literals(CriterionValue value) {
        if (value instanceof TextSetValue set) {
            return set.values();
        }
        if (value instanceof TextValue text && text.text() != null) {
            return List.of(text.text());
        }
        return List.of();
    }

    private static boolean isNonBlankText(CriterionValue value) {
        return value instanceof TextValue text && text.text() != null && !text.text().isBlank();
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
