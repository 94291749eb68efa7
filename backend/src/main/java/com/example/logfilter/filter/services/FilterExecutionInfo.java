package com.example.logfilter.filter.services;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live statistics of one filter run. Updated by the consuming thread, readable
 * from any thread.
 */
public class FilterExecutionInfo {

    public enum State {
        RUNNING,
        COMPLETED,
        CANCELLED
    }

    private final String description;
    private final double estimatedSelectivity;
    private final long startNanos;
    private final AtomicLong itemsProcessed = new AtomicLong();
    private final AtomicLong itemsMatched = new AtomicLong();
    private final AtomicLong itemsFailed = new AtomicLong();
    private final AtomicLong endNanos = new AtomicLong(-1);
    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

    public FilterExecutionInfo(String description, double estimatedSelectivity) {
        this.description = description;
        this.estimatedSelectivity = estimatedSelectivity;
        this.startNanos = System.nanoTime();
    }

    void recordProcessed() {
        itemsProcessed.incrementAndGet();
    }

    void recordMatched() {
        itemsMatched.incrementAndGet();
    }

    void recordFailed() {
        itemsFailed.incrementAndGet();
    }

    void finish(State finalState) {
        if (state.compareAndSet(State.RUNNING, finalState)) {
            endNanos.set(System.nanoTime());
        }
    }

    public String getDescription() {
        return description;
    }

    public double getEstimatedSelectivity() {
        return estimatedSelectivity;
    }

    public long getItemsProcessed() {
        return itemsProcessed.get();
    }

    public long getItemsMatched() {
        return itemsMatched.get();
    }

    public long getItemsFailed() {
        return itemsFailed.get();
    }

    public State getState() {
        return state.get();
    }

    public Duration getElapsed() {
        long end = endNanos.get();
        return Duration.ofNanos((end < 0 ? System.nanoTime() : end) - startNanos);
    }

    /**
     * Matched / processed so far, or 0 before the first record.
     */
    public double getActualSelectivity() {
        long processed = getItemsProcessed();
        return processed == 0 ? 0.0 : (double) getItemsMatched() / processed;
    }

    @Override
    public String toString() {
        return String.format("Filter[%s] %s: %d/%d matched (est. %.2f, actual %.2f) in %d ms",
                description, getState(), getItemsMatched(), getItemsProcessed(),
                estimatedSelectivity, getActualSelectivity(), getElapsed().toMillis());
    }
}
