package com.example.logfilter.filter.services;

import com.example.logfilter.filter.FilterValidationException;
import com.example.logfilter.filter.expression.FilterComposite;
import com.example.logfilter.filter.expression.FilterExpression;
import com.example.logfilter.filter.expression.FilterLeaf;
import com.example.logfilter.filter.expression.SelectivityOptimizer;
import com.example.logfilter.filter.models.CombinationMode;
import com.example.logfilter.filter.models.Criterion;
import com.example.logfilter.filter.models.ValidationError;
import com.example.logfilter.filter.models.ValidationResult;
import com.example.logfilter.filter.registry.FilterStrategyRegistry;
import com.example.logfilter.filter.registry.RecordKind;
import com.example.logfilter.filter.strategy.FieldStrategy;
import com.example.logfilter.metrics.FilterMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Validates criteria, turns them into an optimized expression tree and applies
 * it lazily to a stream of records of one kind.
 *
 * <p>Criteria are always combined under a single composite, even when there is
 * only one. Invalid criteria never reach a record: {@link #apply} fails before
 * the source is touched.
 */
@Slf4j
public class FilterService<T> {

    private final FilterStrategyRegistry<T> registry;
    private final SelectivityOptimizer optimizer;
    private final FilterMetrics metrics;

    public FilterService(FilterStrategyRegistry<T> registry,
                         SelectivityOptimizer optimizer,
                         FilterMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public RecordKind kind() {
        return registry.kind();
    }

    /**
     * Checks every criterion and reports all problems found. Never throws for
     * bad input.
     */
    public ValidationResult validate(List<Criterion> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return ValidationResult.success();
        }

        List<ValidationError> errors = new ArrayList<>();
        for (int i = 0; i < criteria.size(); i++) {
            validateCriterion(i, criteria.get(i), errors);
        }

        ValidationResult result = new ValidationResult(errors);
        if (!result.isValid()) {
            log.debug("{} filter validation {}", registry.kind(), result);
        }
        return result;
    }

    private void validateCriterion(int index, Criterion criterion, List<ValidationError> errors) {
        if (criterion == null) {
            errors.add(new ValidationError(index, null, "Criterion cannot be null"));
            return;
        }

        String field = criterion.field();
        String operator = criterion.operator();

        if (field == null || field.isBlank()) {
            errors.add(new ValidationError(index, field, "Field name cannot be empty"));
            return;
        }
        if (operator == null || operator.isBlank()) {
            errors.add(new ValidationError(index, field, "Operator cannot be empty for field " + field));
            return;
        }
        if (!registry.isFieldSupported(field)) {
            errors.add(new ValidationError(index, field, "Unknown field: " + field));
            return;
        }
        if (!registry.isOperatorSupported(field, operator)) {
            errors.add(new ValidationError(index, field,
                    "Invalid operator '" + operator + "' for field " + field));
            return;
        }
        if (criterion.value() == null) {
            errors.add(new ValidationError(index, field, "Value is required for " + field + " " + operator));
            return;
        }

        FieldStrategy<T> strategy = registry.createStrategy(field, operator);
        if (!strategy.isValidValue(criterion.value())) {
            errors.add(new ValidationError(index, field,
                    "Invalid value '" + criterion.value().display() + "' for " + field + " " + operator));
        }
    }

    /**
     * Builds the optimized expression for already valid criteria.
     *
     * @throws FilterValidationException if any criterion is invalid
     */
    public FilterExpression<T> buildExpression(List<Criterion> criteria, CombinationMode mode) {
        ValidationResult validation = validate(criteria);
        if (!validation.isValid()) {
            metrics.recordValidationFailure(registry.kind());
            throw new FilterValidationException(validation);
        }

        List<Criterion> safeCriteria = criteria == null ? List.of() : criteria;
        List<FilterLeaf<T>> leaves = safeCriteria.stream()
                .map(criterion -> new FilterLeaf<>(
                        registry.createStrategy(criterion.field(), criterion.operator()),
                        criterion.value()))
                .toList();

        FilterComposite<T> composite = new FilterComposite<>(mode == null ? CombinationMode.AND : mode, leaves);
        return optimizer.optimize(composite);
    }

    public Stream<T> apply(List<Criterion> criteria, CombinationMode mode, Stream<T> source) {
        return run(criteria, mode, source, FilterCancellation.none()).records();
    }

    public Stream<T> apply(List<Criterion> criteria,
                           CombinationMode mode,
                           Stream<T> source,
                           FilterCancellation cancellation) {
        return run(criteria, mode, source, cancellation).records();
    }

    /**
     * Like {@link #apply} but also returns the statistics the stream updates as
     * it is consumed.
     */
    public FilterRun<T> run(List<Criterion> criteria,
                            CombinationMode mode,
                            Stream<T> source,
                            FilterCancellation cancellation) {
        Objects.requireNonNull(source, "source");
        FilterExpression<T> expression = buildExpression(criteria, mode);

        FilterExecutionInfo info = new FilterExecutionInfo(expression.description(), expression.estimatedSelectivity());
        log.debug("Starting {} filter: {}", registry.kind(), info.getDescription());

        FilteringSpliterator<T> spliterator = new FilteringSpliterator<>(
                source.spliterator(),
                expression,
                cancellation == null ? FilterCancellation.none() : cancellation,
                info,
                metrics,
                registry.kind());

        Stream<T> records = StreamSupport.stream(spliterator, false).onClose(source::close);
        return new FilterRun<>(records, info);
    }

    public List<String> availableFields() {
        return registry.availableFields();
    }

    public List<String> availableOperators(String field) {
        return registry.availableOperators(field);
    }
}
