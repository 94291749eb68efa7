package com.example.logfilter.filter.registry;

import com.example.logfilter.filter.UnsupportedFieldOrOperatorException;
import com.example.logfilter.filter.models.FilterOperator;
import com.example.logfilter.filter.strategy.FieldStrategy;
import com.example.logfilter.filter.strategy.NumericFieldStrategy;
import com.example.logfilter.filter.strategy.RegexPatternCache;
import com.example.logfilter.filter.strategy.SelectivityProfile;
import com.example.logfilter.filter.strategy.TextFieldStrategy;
import com.example.logfilter.filter.strategy.TimestampFieldStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable map from field name to the strategies available for it, for one
 * record kind. Field lookup ignores case; operator names are normalized by
 * {@link FilterOperator#fromName(String)}.
 *
 * @param <T> record type the strategies evaluate
 */
@Slf4j
public final class FilterStrategyRegistry<T> {

    private final RecordKind kind;
    private final Map<String, FieldDefinition<T>> fields;

    private FilterStrategyRegistry(RecordKind kind, Map<String, FieldDefinition<T>> fields) {
        this.kind = kind;
        this.fields = fields;
    }

    public static <T> Builder<T> builder(RecordKind kind, RegexPatternCache patternCache) {
        return new Builder<>(kind, patternCache);
    }

    public RecordKind kind() {
        return kind;
    }

    public FieldStrategy<T> createStrategy(String field, String operator) {
        FieldDefinition<T> definition = findField(field)
                .orElseThrow(() -> UnsupportedFieldOrOperatorException.unknownField(field));

        FilterOperator parsed = FilterOperator.fromName(operator)
                .filter(definition::supports)
                .orElseThrow(() -> UnsupportedFieldOrOperatorException.unknownOperator(definition.name(), operator));

        return definition.createStrategy(parsed);
    }

    public boolean isFieldSupported(String field) {
        return findField(field).isPresent();
    }

    public boolean isOperatorSupported(String field, String operator) {
        Optional<FilterOperator> parsed = FilterOperator.fromName(operator);
        return parsed.isPresent()
                && findField(field).map(definition -> definition.supports(parsed.get())).orElse(false);
    }

    public List<String> availableFields() {
        return fields.values().stream().map(FieldDefinition::name).toList();
    }

    public List<String> availableOperators(String field) {
        return findField(field)
                .map(definition -> definition.operators().stream().map(FilterOperator::operatorName).toList())
                .orElse(List.of());
    }

    public Optional<String> canonicalFieldName(String field) {
        return findField(field).map(FieldDefinition::name);
    }

    public void register(FieldDefinition<T> definition) {
        throw new UnsupportedOperationException("Registry for " + kind + " is immutable once built");
    }

    public void unregister(String field) {
        throw new UnsupportedOperationException("Registry for " + kind + " is immutable once built");
    }

    private Optional<FieldDefinition<T>> findField(String field) {
        if (field == null || field.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(fields.get(key(field)));
    }

    private static String key(String field) {
        return field.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder<T> {

        private final RecordKind kind;
        private final RegexPatternCache patternCache;
        private final Map<String, FieldDefinition<T>> fields = new LinkedHashMap<>();

        private Builder(RecordKind kind, RegexPatternCache patternCache) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.patternCache = Objects.requireNonNull(patternCache, "patternCache");
        }

        public Builder<T> field(FieldDefinition<T> definition) {
            FieldDefinition<T> previous = fields.putIfAbsent(key(definition.name()), definition);
            if (previous != null) {
                throw new IllegalArgumentException("Field " + definition.name() + " is already registered for " + kind);
            }
            return this;
        }

        public Builder<T> textField(String name,
                                    Function<T, String> accessor,
                                    SelectivityProfile profile,
                                    FilterOperator... operators) {
            return field(new FieldDefinition<>(name, operatorSet(operators),
                    op -> new TextFieldStrategy<>(name, op, accessor, profile, patternCache)));
        }

        public Builder<T> timestampField(String name, Function<T, Instant> accessor) {
            return field(new FieldDefinition<>(name, TimestampFieldStrategy.OPERATORS,
                    op -> new TimestampFieldStrategy<>(name, op, accessor)));
        }

        public Builder<T> numericField(String name, Function<T, Number> accessor) {
            return field(new FieldDefinition<>(name, NumericFieldStrategy.OPERATORS,
                    op -> new NumericFieldStrategy<>(name, op, accessor)));
        }

        public FilterStrategyRegistry<T> build() {
            log.debug("Built {} filter registry with fields {}", kind, fields.keySet());
            return new FilterStrategyRegistry<>(kind, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }

        private static Set<FilterOperator> operatorSet(FilterOperator... operators) {
            if (operators.length == 0) {
                return TextFieldStrategy.OPERATORS;
            }
            return EnumSet.copyOf(Arrays.asList(operators));
        }
    }
}
