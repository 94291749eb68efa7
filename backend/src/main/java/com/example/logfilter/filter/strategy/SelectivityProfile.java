package com.example.logfilter.filter.strategy;

import com.example.logfilter.filter.models.CriterionValue;
import com.example.logfilter.filter.models.FilterOperator;
import com.example.logfilter.filter.models.TextSetValue;
import com.example.logfilter.filter.models.TextValue;

import java.util.Locale;

/**
 * Per-field selectivity heuristics. Estimates are relative: only their ordering
 * matters to the optimizer. Negated operators are always the complement of their
 * positive counterpart, and every estimate is clamped to {@code [0, 1]}.
 */
public enum SelectivityProfile {

    BASE {
        @Override
        double estimatePositive(FilterOperator operator, CriterionValue value) {
            return base(operator, value);
        }
    },

    LEVEL {
        @Override
        double estimatePositive(FilterOperator operator, CriterionValue value) {
            if (value instanceof TextValue text && text.text() != null) {
                return levelFrequency(text.text());
            }
            if (value instanceof TextSetValue set) {
                return switch (operator) {
                    case EQUALS -> 0.2;
                    case CONTAINS -> 0.3;
                    case IN -> set.values().stream()
                            .mapToDouble(SelectivityProfile::levelFrequency)
                            .sum();
                    default -> 0.5;
                };
            }
            return base(operator, value);
        }
    },

    MESSAGE {
        @Override
        double estimatePositive(FilterOperator operator, CriterionValue value) {
            int length = literalLength(value);
            return switch (operator) {
                case EQUALS -> length > 20 ? 0.05 : 0.15;
                case CONTAINS -> length <= 3 ? 0.7 : length <= 10 ? 0.4 : 0.15;
                case STARTS_WITH, ENDS_WITH -> length <= 5 ? 0.3 : 0.1;
                case REGEX -> 0.25;
                default -> base(operator, value);
            };
        }
    },

    NODE {
        @Override
        double estimatePositive(FilterOperator operator, CriterionValue value) {
            int length = literalLength(value);
            return switch (operator) {
                case EQUALS -> 0.3;
                case CONTAINS -> length <= 3 ? 0.6 : length <= 8 ? 0.4 : 0.2;
                case STARTS_WITH, ENDS_WITH -> 0.3;
                case IN -> 0.5;
                default -> base(operator, value);
            };
        }
    },

    USERNAME {
        @Override
        double estimatePositive(FilterOperator operator, CriterionValue value) {
            int length = literalLength(value);
            return switch (operator) {
                case EQUALS -> 0.2;
                case CONTAINS -> length <= 3 ? 0.5 : length <= 8 ? 0.3 : 0.15;
                case STARTS_WITH, ENDS_WITH -> length <= 3 ? 0.4 : length <= 6 ? 0.2 : 0.1;
                case IN -> 0.4;
                default -> base(operator, value);
            };
        }
    },

    PROCESS_UID {
        @Override
        double estimatePositive(FilterOperator operator, CriterionValue value) {
            int length = literalLength(value);
            return switch (operator) {
                case EQUALS -> 0.05;
                case CONTAINS -> length <= 4 ? 0.4 : length <= 10 ? 0.2 : 0.05;
                case STARTS_WITH, ENDS_WITH -> length <= 4 ? 0.3 : length <= 8 ? 0.1 : 0.05;
                default -> base(operator, value);
            };
        }
    },

    TIMESTAMP {
        @Override
        double estimatePositive(FilterOperator operator, CriterionValue value) {
            return switch (operator) {
                case EQUALS -> 0.05;
                case GREATER_THAN, LESS_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN_OR_EQUAL -> 0.5;
                case BETWEEN -> 0.2;
                default -> base(operator, value);
            };
        }
    },

    NUMERIC {
        @Override
        double estimatePositive(FilterOperator operator, CriterionValue value) {
            return switch (operator) {
                case EQUALS -> 0.1;
                case GREATER_THAN, LESS_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN_OR_EQUAL -> 0.5;
                case IN -> 0.3;
                default -> base(operator, value);
            };
        }
    };

    abstract double estimatePositive(FilterOperator operator, CriterionValue value);

    public double estimate(FilterOperator operator, CriterionValue value) {
        double positive = clamp(estimatePositive(operator.positive(), value));
        return operator.isNegated() ? clamp(1.0 - positive) : positive;
    }

    private static double base(FilterOperator operator, CriterionValue value) {
        return switch (operator) {
            case EQUALS -> 0.1;
            case NOT_EQUALS -> 0.9;
            case CONTAINS -> 0.3;
            case NOT_CONTAINS -> 0.7;
            case STARTS_WITH, ENDS_WITH -> 0.2;
            case GREATER_THAN, LESS_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN_OR_EQUAL -> 0.5;
            case BETWEEN -> 0.3;
            case REGEX -> 0.4;
            case IN -> 0.4;
            case NOT_IN -> 0.6;
        };
    }

    private static double levelFrequency(String level) {
        return switch (level.trim().toLowerCase(Locale.ROOT)) {
            case "error", "fatal", "critical" -> 0.05;
            case "warn", "warning" -> 0.15;
            case "info", "information" -> 0.5;
            case "debug" -> 0.3;
            case "trace" -> 0.1;
            default -> 0.25;
        };
    }

    private static int literalLength(CriterionValue value) {
        if (value instanceof TextValue text && text.text() != null) {
            return text.text().length();
        }
        return 0;
    }

    private static double clamp(double estimate) {
        if (Double.isNaN(estimate)) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, estimate));
    }
}
