package com.example.logfilter.rabbitmq.services;

import com.example.logfilter.logs.TimestampParser;
import com.example.logfilter.logs.models.RabbitMqLogEntry;
import com.example.logfilter.logs.models.RabbitMqProperties;
import com.example.logfilter.metrics.FilterMetrics;
import com.example.logfilter.rabbitmq.models.PairedFileData;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Rebuilds {@link RabbitMqLogEntry} records from paired message dumps.
 *
 * <p>Every JSON path is optional: an absent path leaves the field {@code null}.
 * Unreadable main files skip the message id; an unreadable headers file only
 * costs the fault fields.
 */
@Slf4j
@Service
public class PairedFileReconstructor {

    private static final String URN_PREFIX = "urn:message:";
    private static final Pattern QUEUE_NAME_PATTERN = Pattern.compile("/([^/?]+)(\\?|$)");

    private final ObjectMapper objectMapper;
    private final PairedFileDetectionService detectionService;
    private final FilterMetrics metrics;

    public PairedFileReconstructor(ObjectMapper objectMapper,
                                   PairedFileDetectionService detectionService,
                                   FilterMetrics metrics) {
        this.objectMapper = objectMapper;
        this.detectionService = detectionService;
        this.metrics = metrics;
    }

    public Optional<RabbitMqLogEntry> reconstruct(PairedFileData pair) {
        Optional<RabbitMqLogEntry> entry = doReconstruct(pair);
        if (entry.isPresent()) {
            metrics.recordFileReconstructed();
        } else {
            metrics.recordFileSkipped();
        }
        return entry;
    }

    public Stream<RabbitMqLogEntry> reconstructAll(Stream<PairedFileData> pairs) {
        return pairs.map(this::reconstruct).flatMap(Optional::stream);
    }

    public Stream<RabbitMqLogEntry> loadDirectory(Path directory) {
        return reconstructAll(detectionService.detectPairedFiles(directory));
    }

    private Optional<RabbitMqLogEntry> doReconstruct(PairedFileData pair) {
        if (pair == null) {
            return Optional.empty();
        }

        switch (pair.status()) {
            case FAILED -> {
                log.warn("Cannot reconstruct failed pair {}: {}", pair.messageId(), pair.errorMessage());
                return Optional.empty();
            }
            case UNIFIED_JSON -> {
                return parseUnified(pair);
            }
            case COMPLETE -> {
                return parseComplete(pair);
            }
            default -> {
                if (pair.hasMainFileOnly()) {
                    return parseMainOnly(pair);
                }
                log.debug("Skipping message {}: headers file without a main file", pair.messageId());
                return Optional.empty();
            }
        }
    }

    // ==================== Complete pair ====================

    private Optional<RabbitMqLogEntry> parseComplete(PairedFileData pair) {
        Optional<MainFile> main = readMain(pair);
        if (main.isEmpty()) {
            return Optional.empty();
        }

        RabbitMqLogEntry.RabbitMqLogEntryBuilder builder = mainFields(main.get())
                .rawJson(main.get().content());

        readHeadersSection(pair).ifPresent(headers -> builder
                .faultMessage(text(headers.path("MT-Fault-Message")))
                .stackTrace(text(headers.path("MT-Fault-StackTrace")))
                .faultTimestamp(instant(headers.path("MT-Fault-Timestamp"))));

        RabbitMqLogEntry entry = builder.build();
        log.debug("Reconstructed message {}: processUid={}, userName={}, sentTime={}",
                pair.messageId(), entry.getProcessUid(), entry.getUserName(), entry.getSentTime());
        return Optional.of(entry);
    }

    // ==================== Unified JSON ====================

    private Optional<RabbitMqLogEntry> parseUnified(PairedFileData pair) {
        Optional<MainFile> main = readMain(pair);
        if (main.isEmpty()) {
            return Optional.empty();
        }

        JsonNode root = main.get().root();
        if (!root.isObject() || !root.has("message") || !root.has("sentTime") || !root.has("headers")) {
            log.warn("Main file for message {} is not unified JSON any more", pair.messageId());
            return Optional.empty();
        }

        RabbitMqLogEntry.RabbitMqLogEntryBuilder builder = mainFields(main.get())
                .rawJson(main.get().content());

        String messageId = text(root.path("messageId"));
        if (messageId != null) {
            builder.properties(RabbitMqProperties.builder().messageId(messageId).build());
        }

        String messageType = lastMessageType(root.path("messageType"));
        String message = null;
        if (messageType != null) {
            message = messageType.startsWith(URN_PREFIX) ? messageType.substring(URN_PREFIX.length()) : messageType;
            builder.message(message).level("INFO");
        }

        String destination = text(root.path("destinationAddress"));
        if (destination != null) {
            Matcher matcher = QUEUE_NAME_PATTERN.matcher(destination);
            if (matcher.find()) {
                builder.node(matcher.group(1));
            }
        }

        if (pair.headersFile() != null && Files.isRegularFile(pair.headersFile())) {
            String currentMessage = message;
            readHeadersSection(pair).ifPresent(headers -> mergeHeaders(builder, headers, currentMessage));
        }

        return Optional.of(builder.build());
    }

    private void mergeHeaders(RabbitMqLogEntry.RabbitMqLogEntryBuilder builder, JsonNode headers, String message) {
        String consumerType = text(headers.path("MT-Fault-ConsumerType"));
        if (consumerType != null) {
            builder.node(consumerType);
        }

        String stackTrace = null;
        String exceptionType = text(headers.path("MT-Fault-ExceptionType"));
        if (exceptionType != null) {
            String faultMessage = text(headers.path("MT-Fault-Message"));
            stackTrace = faultMessage != null ? exceptionType + ": " + faultMessage : exceptionType;
        }

        String fullStackTrace = text(headers.path("MT-Fault-StackTrace"));
        if (fullStackTrace != null && !fullStackTrace.isEmpty()) {
            stackTrace = stackTrace != null && !stackTrace.isEmpty()
                    ? stackTrace + "\n" + fullStackTrace
                    : fullStackTrace;
        }
        if (stackTrace != null) {
            builder.stackTrace(stackTrace);
        }

        Instant faultTimestamp = instant(headers.path("MT-Fault-Timestamp"));
        if (faultTimestamp != null) {
            builder.faultTimestamp(faultTimestamp);
        }

        String contentType = text(headers.path("Content-Type"));
        if (contentType != null && !contentType.isEmpty() && (message == null || message.isEmpty())) {
            builder.message("Content-Type: " + contentType);
        }
    }

    // ==================== Main file only ====================

    private Optional<RabbitMqLogEntry> parseMainOnly(PairedFileData pair) {
        try {
            String content = Files.readString(pair.mainFile(), StandardCharsets.UTF_8);
            RabbitMqLogEntry entry = objectMapper.readValue(content, RabbitMqLogEntry.class);
            if (entry == null) {
                log.warn("Main file for message {} is empty", pair.messageId());
                return Optional.empty();
            }
            return Optional.of(entry.toBuilder().rawJson(content).build());
        } catch (IOException e) {
            log.warn("Failed to parse main file {} for message {}: {}", pair.mainFile(), pair.messageId(), e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== JSON helpers ====================

    private RabbitMqLogEntry.RabbitMqLogEntryBuilder mainFields(MainFile main) {
        JsonNode root = main.root();
        return RabbitMqLogEntry.builder()
                .processUid(text(root.path("message").path("processUId")))
                .sentTime(instant(root.path("sentTime")))
                .userName(text(root.path("headers").path("Context").path("userContext").path("UserName")));
    }

    private Optional<MainFile> readMain(PairedFileData pair) {
        if (pair.mainFile() == null) {
            log.warn("Message {} has no main file", pair.messageId());
            return Optional.empty();
        }
        try {
            String content = Files.readString(pair.mainFile(), StandardCharsets.UTF_8);
            JsonNode root = objectMapper.readTree(content);
            if (root == null || root.isMissingNode()) {
                log.warn("Main file {} for message {} is empty", pair.mainFile(), pair.messageId());
                return Optional.empty();
            }
            return Optional.of(new MainFile(content, root));
        } catch (IOException e) {
            log.warn("Failed to read main file {} for message {}: {}", pair.mainFile(), pair.messageId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return the {@code headers} object of the headers file, empty when the file
     *         is absent, unreadable or has no such section
     */
    private Optional<JsonNode> readHeadersSection(PairedFileData pair) {
        Path headersFile = pair.headersFile();
        if (headersFile == null) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(headersFile.toFile());
            JsonNode headers = root == null ? null : root.get("headers");
            if (headers == null || !headers.isObject()) {
                log.debug("No headers section in {}", headersFile);
                return Optional.empty();
            }
            return Optional.of(headers);
        } catch (IOException e) {
            log.warn("Failed to read headers file {} for message {}, using main file fields only: {}",
                    headersFile, pair.messageId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String lastMessageType(JsonNode messageTypes) {
        if (!messageTypes.isArray()) {
            return null;
        }
        String last = null;
        for (JsonNode type : messageTypes) {
            if (type.isTextual() && !type.asText().isEmpty()) {
                last = type.asText();
            }
        }
        return last;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }

    private static Instant instant(JsonNode node) {
        return TimestampParser.parse(text(node)).orElse(null);
    }

    private record MainFile(String content, JsonNode root) {
    }
}
