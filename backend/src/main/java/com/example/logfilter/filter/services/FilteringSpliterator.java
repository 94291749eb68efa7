package com.example.logfilter.filter.services;

import com.example.logfilter.filter.expression.FilterExpression;
import com.example.logfilter.filter.registry.RecordKind;
import com.example.logfilter.metrics.FilterMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Pulls records one at a time from the source and hands on those the expression
 * accepts. Holds at most the record currently being evaluated.
 */
@Slf4j
class FilteringSpliterator<T> extends Spliterators.AbstractSpliterator<T> {

    private final Spliterator<T> source;
    private final FilterExpression<T> expression;
    private final FilterCancellation cancellation;
    private final FilterExecutionInfo info;
    private final FilterMetrics metrics;
    private final RecordKind kind;

    FilteringSpliterator(Spliterator<T> source,
                         FilterExpression<T> expression,
                         FilterCancellation cancellation,
                         FilterExecutionInfo info,
                         FilterMetrics metrics,
                         RecordKind kind) {
        super(Long.MAX_VALUE, source.characteristics() & Spliterator.ORDERED);
        this.source = source;
        this.expression = expression;
        this.cancellation = cancellation;
        this.info = info;
        this.metrics = metrics;
        this.kind = kind;
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> action) {
        MatchHolder<T> holder = new MatchHolder<>();
        while (true) {
            throwIfCancelled();
            if (!source.tryAdvance(record -> evaluate(record, holder))) {
                info.finish(FilterExecutionInfo.State.COMPLETED);
                log.debug("{}", info);
                return false;
            }
            // a record pulled while the run was being cancelled is dropped
            throwIfCancelled();
            if (holder.matched) {
                action.accept(holder.record);
                return true;
            }
        }
    }

    private void throwIfCancelled() {
        if (cancellation.isCancelled()) {
            info.finish(FilterExecutionInfo.State.CANCELLED);
            log.debug("Filter [{}] cancelled after {} records", info.getDescription(), info.getItemsProcessed());
            throw new CancellationException("Filter run was cancelled");
        }
    }

    private void evaluate(T record, MatchHolder<T> holder) {
        info.recordProcessed();
        metrics.recordScanned(kind);
        boolean matched;
        try {
            matched = expression.matches(record);
        } catch (RuntimeException e) {
            info.recordFailed();
            metrics.recordError(kind);
            log.debug("Excluding record after evaluation error in [{}]: {}", info.getDescription(), e.getMessage(), e);
            return;
        }
        if (matched) {
            info.recordMatched();
            metrics.recordMatched(kind);
            holder.record = record;
            holder.matched = true;
        }
    }

    private static final class MatchHolder<T> {
        private T record;
        private boolean matched;
    }
}
