package com.example.logfilter.metrics;

import com.example.logfilter.filter.registry.RecordKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Filter engine counters, tagged by record kind.
 *
 * METRICS TRACKED:
 * - filter.records.scanned: records pulled from a source and evaluated
 * - filter.records.matched: records passed downstream
 * - filter.records.errors: records dropped because evaluation threw
 * - filter.validation.failures: filter requests rejected before any record was read
 * - rabbitmq.files.reconstructed / rabbitmq.files.skipped: paired-file reconstruction outcomes
 */
@Slf4j
@Component
public class FilterMetrics {

    private final Map<RecordKind, Counter> scannedCounters = new EnumMap<>(RecordKind.class);
    private final Map<RecordKind, Counter> matchedCounters = new EnumMap<>(RecordKind.class);
    private final Map<RecordKind, Counter> errorCounters = new EnumMap<>(RecordKind.class);
    private final Map<RecordKind, Counter> validationFailureCounters = new EnumMap<>(RecordKind.class);

    private final Counter filesReconstructedCounter;
    private final Counter filesSkippedCounter;
    private final Timer directoryScanTime;

    public FilterMetrics(MeterRegistry meterRegistry) {
        for (RecordKind kind : RecordKind.values()) {
            scannedCounters.put(kind, Counter.builder("filter.records.scanned")
                    .description("Total number of records evaluated by a filter")
                    .tag("kind", kind.pathName())
                    .register(meterRegistry));

            matchedCounters.put(kind, Counter.builder("filter.records.matched")
                    .description("Total number of records that passed a filter")
                    .tag("kind", kind.pathName())
                    .register(meterRegistry));

            errorCounters.put(kind, Counter.builder("filter.records.errors")
                    .description("Total number of records dropped because evaluation failed")
                    .tag("kind", kind.pathName())
                    .register(meterRegistry));

            validationFailureCounters.put(kind, Counter.builder("filter.validation.failures")
                    .description("Total number of filter requests rejected by validation")
                    .tag("kind", kind.pathName())
                    .register(meterRegistry));
        }

        this.filesReconstructedCounter = Counter.builder("rabbitmq.files.reconstructed")
                .description("Total number of RabbitMQ messages rebuilt from files")
                .register(meterRegistry);

        this.filesSkippedCounter = Counter.builder("rabbitmq.files.skipped")
                .description("Total number of RabbitMQ message ids that produced no record")
                .register(meterRegistry);

        this.directoryScanTime = Timer.builder("rabbitmq.directory.scan.duration")
                .description("Time taken to detect paired files in a directory")
                .register(meterRegistry);
    }

    public void recordScanned(RecordKind kind) {
        scannedCounters.get(kind).increment();
    }

    public void recordMatched(RecordKind kind) {
        matchedCounters.get(kind).increment();
    }

    public void recordError(RecordKind kind) {
        errorCounters.get(kind).increment();
    }

    public void recordValidationFailure(RecordKind kind) {
        validationFailureCounters.get(kind).increment();
    }

    public void recordFileReconstructed() {
        filesReconstructedCounter.increment();
    }

    public void recordFileSkipped() {
        filesSkippedCounter.increment();
    }

    public void recordDirectoryScan(long startTimeNanos) {
        directoryScanTime.record(System.nanoTime() - startTimeNanos, TimeUnit.NANOSECONDS);
    }

    public double scannedCount(RecordKind kind) {
        return scannedCounters.get(kind).count();
    }

    public double matchedCount(RecordKind kind) {
        return matchedCounters.get(kind).count();
    }

    public double errorCount(RecordKind kind) {
        return errorCounters.get(kind).count();
    }

    public double validationFailureCount(RecordKind kind) {
        return validationFailureCounters.get(kind).count();
    }

    /**
     * Log filter statistics every 5 minutes.
     */
    @Scheduled(fixedDelay = 300000)
    public void logFilterStats() {
        for (RecordKind kind : RecordKind.values()) {
            double scanned = scannedCount(kind);
            if (scanned == 0) {
                continue;
            }
            double matched = matchedCount(kind);
            log.info("Filter stats [{}] - Scanned: {}, Matched: {} ({}%), Errors: {}, Rejected requests: {}",
                    kind,
                    (long) scanned,
                    (long) matched,
                    String.format("%.1f", matched / scanned * 100),
                    (long) errorCount(kind),
                    (long) validationFailureCount(kind));
        }
        if (filesReconstructedCounter.count() + filesSkippedCounter.count() > 0) {
            log.info("RabbitMQ reconstruction stats - Rebuilt: {}, Skipped: {}",
                    (long) filesReconstructedCounter.count(),
                    (long) filesSkippedCounter.count());
        }
    }
}
