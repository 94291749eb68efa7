package com.example.logfilter.logs;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient timestamp parsing shared by the timestamp filters and the RabbitMQ
 * file reconstruction. Values without an offset are read as UTC.
 */
public final class TimestampParser {

    private static final List<Function<String, Instant>> PARSERS = List.of(
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            value -> LocalDateTime.parse(value, DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private TimestampParser() {
    }

    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        return PARSERS.stream()
                .map(parser -> tryParse(parser, value))
                .flatMap(Optional::stream)
                .findFirst();
    }

    public static boolean isTimestamp(String text) {
        return parse(text).isPresent();
    }

    private static Optional<Instant> tryParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
