package com.example.logfilter.filter.services;

import com.example.logfilter.filter.FilterValidationException;
import com.example.logfilter.filter.expression.FilterExpression;
import com.example.logfilter.filter.expression.SelectivityOptimizer;
import com.example.logfilter.filter.models.CombinationMode;
import com.example.logfilter.filter.models.Criterion;
import com.example.logfilter.filter.models.CriterionValue;
import com.example.logfilter.filter.models.ValidationError;
import com.example.logfilter.filter.models.ValidationResult;
import com.example.logfilter.filter.registry.FilterStrategyRegistry;
import com.example.logfilter.filter.registry.RabbitMqLogEntryFields;
import com.example.logfilter.filter.registry.RecordKind;
import com.example.logfilter.filter.strategy.RegexPatternCache;
import com.example.logfilter.filter.strategy.SelectivityProfile;
import com.example.logfilter.logs.models.LogEntry;
import com.example.logfilter.logs.models.RabbitMqLogEntry;
import com.example.logfilter.metrics.FilterMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FilterServiceTest {

    private FilterMetrics metrics;
    private FilterService<RabbitMqLogEntry> filterService;

    private final List<RabbitMqLogEntry> records = List.of(
            entry("INFO", "rabbit1", "queue started"),
            entry("ERROR", "rabbit2", "connection refused"),
            entry("ERROR", "broker-east", "channel closed"),
            entry("WARN", "rabbit1", "memory alarm"),
            entry("ERROR", "rabbit1", "consumer crashed"));

    @BeforeEach
    void setUp() {
        metrics = new FilterMetrics(new SimpleMeterRegistry());
        filterService = new FilterService<>(
                RabbitMqLogEntryFields.registry(new RegexPatternCache()),
                new SelectivityOptimizer(),
                metrics);
    }

    private static RabbitMqLogEntry entry(String level, String node, String message) {
        return RabbitMqLogEntry.builder().level(level).node(node).message(message).build();
    }

    // ==================== Validation ====================

    @Test
    void shouldAcceptValidCriteria() {
        ValidationResult result = filterService.validate(List.of(
                Criterion.of("Level", "equals", CriterionValue.text("ERROR")),
                Criterion.of("Timestamp", "between", CriterionValue.set("2024-01-01", "2024-02-01"))));

        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void shouldReportUnknownField() {
        ValidationResult result = filterService.validate(List.of(
                Criterion.of("Nonexistent", "equals", CriterionValue.text("x"))));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly(
                new ValidationError(0, "Nonexistent", "Unknown field: Nonexistent"));
    }

    @Test
    void shouldCollectEveryError() {
        ValidationResult result = filterService.validate(List.of(
                Criterion.of("Level", "equals", CriterionValue.text("ERROR")),
                Criterion.of(" ", "equals", CriterionValue.text("x")),
                Criterion.of("Level", "", CriterionValue.text("x")),
                Criterion.of("Level", "regex", CriterionValue.text("x")),
                Criterion.of("Message", "regex", CriterionValue.text("[oops")),
                Criterion.of("Node", "equals", null)));

        assertThat(result.errors()).extracting(ValidationError::criterionIndex).containsExactly(1, 2, 3, 4, 5);
        assertThat(result.errorsFor(1).get(0).reason()).isEqualTo("Field name cannot be empty");
        assertThat(result.errorsFor(2).get(0).reason()).isEqualTo("Operator cannot be empty for field Level");
        assertThat(result.errorsFor(3).get(0).reason()).isEqualTo("Invalid operator 'regex' for field Level");
        assertThat(result.errorsFor(4).get(0).reason()).isEqualTo("Invalid value '[oops' for Message regex");
        assertThat(result.errorsFor(5).get(0).reason()).isEqualTo("Value is required for Node equals");
    }

    @Test
    void shouldTreatMissingCriteriaAsValid() {
        assertThat(filterService.validate(null).isValid()).isTrue();
        assertThat(filterService.validate(List.of()).isValid()).isTrue();
    }

    // ==================== Apply ====================

    @Test
    void shouldReturnErrorRecordsInSourceOrder() {
        List<RabbitMqLogEntry> result = filterService.apply(
                List.of(Criterion.of("Level", "equals", CriterionValue.text("ERROR"))),
                CombinationMode.AND,
                records.stream()).toList();

        assertThat(result).containsExactly(records.get(1), records.get(2), records.get(4));
    }

    @Test
    void shouldEvaluateMostSelectiveCriterionFirst() {
        List<Criterion> criteria = List.of(
                Criterion.of("Node", "contains", CriterionValue.text("rabbit")),
                Criterion.of("Level", "equals", CriterionValue.text("ERROR")));

        FilterExpression<RabbitMqLogEntry> expression = filterService.buildExpression(criteria, CombinationMode.AND);
        List<RabbitMqLogEntry> result = filterService.apply(criteria, CombinationMode.AND, records.stream()).toList();

        assertThat(expression.description()).isEqualTo("(Level equals ERROR) AND (Node contains rabbit)");
        List<RabbitMqLogEntry> unordered = records.stream()
                .filter(r -> r.getNode().contains("rabbit") && r.getLevel().equals("ERROR"))
                .toList();
        assertThat(result).isEqualTo(unordered).containsExactly(records.get(1), records.get(4));
    }

    @Test
    void shouldRefuseToRunInvalidCriteria() {
        AtomicInteger pulled = new AtomicInteger();
        List<Criterion> criteria = List.of(Criterion.of("Nonexistent", "equals", CriterionValue.text("x")));
        ValidationResult expected = filterService.validate(criteria);

        assertThatThrownBy(() -> filterService.apply(criteria, CombinationMode.AND,
                records.stream().peek(r -> pulled.incrementAndGet())))
                .isInstanceOfSatisfying(FilterValidationException.class,
                        e -> assertThat(e.getValidationResult()).isEqualTo(expected));

        assertThat(pulled).hasValue(0);
        assertThat(metrics.validationFailureCount(RecordKind.RABBITMQ)).isEqualTo(1.0);
    }

    @Test
    void shouldMatchEverythingForEmptyAndNothingForEmptyOr() {
        assertThat(filterService.apply(List.of(), CombinationMode.AND, records.stream()).toList())
                .containsExactlyElementsOf(records);
        assertThat(filterService.apply(List.of(), CombinationMode.OR, records.stream()).toList())
                .isEmpty();
    }

    @Test
    void shouldCombineWithOr() {
        List<RabbitMqLogEntry> result = filterService.apply(List.of(
                        Criterion.of("Level", "equals", CriterionValue.text("WARN")),
                        Criterion.of("Node", "equals", CriterionValue.text("broker-east"))),
                CombinationMode.OR,
                records.stream()).toList();

        assertThat(result).containsExactly(records.get(2), records.get(3));
    }

    @Test
    void shouldGiveSameResultRegardlessOfAndOrder() {
        Criterion level = Criterion.of("Level", "notequals", CriterionValue.text("INFO"));
        Criterion node = Criterion.of("Node", "startswith", CriterionValue.text("rabbit"));

        List<RabbitMqLogEntry> forward = filterService.apply(List.of(level, node), CombinationMode.AND, records.stream()).toList();
        List<RabbitMqLogEntry> reverse = filterService.apply(List.of(node, level), CombinationMode.AND, records.stream()).toList();
        List<RabbitMqLogEntry> again = filterService.apply(List.of(level, node), CombinationMode.AND, records.stream()).toList();

        assertThat(forward).isEqualTo(reverse).isEqualTo(again)
                .containsExactly(records.get(1), records.get(3), records.get(4));
    }

    @Test
    void shouldNotMatchMissingFieldEvenWhenNegated() {
        RabbitMqLogEntry anonymous = entry("INFO", "rabbit1", "no user");

        List<RabbitMqLogEntry> result = filterService.apply(
                List.of(Criterion.of("Username", "notequals", CriterionValue.text("alice"))),
                CombinationMode.AND,
                Stream.of(anonymous)).toList();

        assertThat(result).isEmpty();
    }

    @Test
    void shouldNotMatchRecordWithoutLevel() {
        RabbitMqLogEntry levelless = RabbitMqLogEntry.builder().node("rabbit1").build();

        List<RabbitMqLogEntry> equalsInfo = filterService.apply(
                List.of(Criterion.of("Level", "equals", CriterionValue.text("info"))),
                CombinationMode.AND,
                Stream.of(levelless)).toList();
        List<RabbitMqLogEntry> notEqualsError = filterService.apply(
                List.of(Criterion.of("Level", "notequals", CriterionValue.text("error"))),
                CombinationMode.AND,
                Stream.of(levelless)).toList();

        assertThat(levelless.getEffectiveLevel()).isNull();
        assertThat(equalsInfo).isEmpty();
        assertThat(notEqualsError).isEmpty();
    }

    @Test
    void shouldPullSourceLazily() {
        AtomicInteger pulled = new AtomicInteger();

        Stream<RabbitMqLogEntry> result = filterService.apply(
                List.of(Criterion.of("Level", "equals", CriterionValue.text("ERROR"))),
                CombinationMode.AND,
                records.stream().peek(r -> pulled.incrementAndGet()));

        assertThat(pulled).hasValue(0);
        assertThat(result.findFirst()).contains(records.get(1));
        assertThat(pulled).hasValue(2);
    }

    @Test
    void shouldStopWithCancellationAfterYieldedPrefix() {
        FilterCancellation cancellation = new FilterCancellation();
        Iterator<RabbitMqLogEntry> iterator = filterService.apply(
                List.of(Criterion.of("Level", "equals", CriterionValue.text("ERROR"))),
                CombinationMode.AND,
                records.stream(),
                cancellation).iterator();

        List<RabbitMqLogEntry> seen = new ArrayList<>();
        seen.add(iterator.next());
        cancellation.cancel();

        assertThatThrownBy(iterator::hasNext).isInstanceOf(CancellationException.class);
        assertThat(seen).containsExactly(records.get(1));
    }

    @Test
    void shouldNotYieldRecordPulledDuringCancellation() {
        FilterCancellation cancellation = new FilterCancellation();
        List<RabbitMqLogEntry> source = List.of(
                entry("ERROR", "rabbit1", "m1"),
                entry("ERROR", "rabbit1", "m2"),
                entry("ERROR", "rabbit1", "m3"));

        Stream<RabbitMqLogEntry> result = filterService.apply(
                List.of(Criterion.of("Level", "equals", CriterionValue.text("ERROR"))),
                CombinationMode.AND,
                source.stream().peek(r -> {
                    if ("m2".equals(r.getMessage())) {
                        cancellation.cancel();
                    }
                }),
                cancellation);

        List<String> seen = new ArrayList<>();
        assertThatThrownBy(() -> result.forEach(r -> seen.add(r.getMessage())))
                .isInstanceOf(CancellationException.class);
        assertThat(seen).containsExactly("m1");
    }

    @Test
    void shouldExcludeRecordWhoseEvaluationThrows() {
        FilterStrategyRegistry<LogEntry> registry = FilterStrategyRegistry.<LogEntry>builder(RecordKind.GENERIC, new RegexPatternCache())
                .textField("Message", entry -> {
                    if ("broken".equals(entry.getSource())) {
                        throw new IllegalStateException("corrupt record");
                    }
                    return entry.getMessage();
                }, SelectivityProfile.MESSAGE)
                .build();
        FilterService<LogEntry> service = new FilterService<>(registry, new SelectivityOptimizer(), metrics);

        List<LogEntry> source = List.of(
                LogEntry.builder().source("a").message("timeout").build(),
                LogEntry.builder().source("broken").message("timeout").build(),
                LogEntry.builder().source("c").message("timeout again").build());

        FilterRun<LogEntry> run = service.run(
                List.of(Criterion.of("Message", "contains", CriterionValue.text("timeout"))),
                CombinationMode.AND,
                source.stream(),
                FilterCancellation.none());

        assertThat(run.records().toList()).containsExactly(source.get(0), source.get(2));
        assertThat(run.info().getItemsProcessed()).isEqualTo(3);
        assertThat(run.info().getItemsMatched()).isEqualTo(2);
        assertThat(run.info().getItemsFailed()).isEqualTo(1);
        assertThat(metrics.errorCount(RecordKind.GENERIC)).isEqualTo(1.0);
    }

    @Test
    void shouldTrackExecutionInfo() {
        FilterRun<RabbitMqLogEntry> run = filterService.run(
                List.of(Criterion.of("Level", "equals", CriterionValue.text("ERROR"))),
                CombinationMode.AND,
                records.stream(),
                FilterCancellation.none());

        assertThat(run.info().getState()).isEqualTo(FilterExecutionInfo.State.RUNNING);
        assertThat(run.records().count()).isEqualTo(3);

        assertThat(run.info().getState()).isEqualTo(FilterExecutionInfo.State.COMPLETED);
        assertThat(run.info().getDescription()).isEqualTo("(Level equals ERROR)");
        assertThat(run.info().getItemsProcessed()).isEqualTo(5);
        assertThat(run.info().getActualSelectivity()).isEqualTo(0.6);
        assertThat(metrics.scannedCount(RecordKind.RABBITMQ)).isEqualTo(5.0);
        assertThat(metrics.matchedCount(RecordKind.RABBITMQ)).isEqualTo(3.0);
    }

    @Test
    void shouldExposeRegistryCatalog() {
        assertThat(filterService.availableFields()).contains("Level", "Node");
        assertThat(filterService.availableOperators("Level")).contains("equals", "in");
        assertThat(filterService.availableOperators("Nope")).isEmpty();
    }
}
