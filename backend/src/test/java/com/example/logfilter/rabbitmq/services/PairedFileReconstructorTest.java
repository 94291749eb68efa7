package com.example.logfilter.rabbitmq.services;

import com.example.logfilter.config.FilterEngineProperties;
import com.example.logfilter.logs.models.RabbitMqLogEntry;
import com.example.logfilter.metrics.FilterMetrics;
import com.example.logfilter.rabbitmq.models.PairedFileData;
import com.example.logfilter.rabbitmq.models.PairedFileStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class PairedFileReconstructorTest {

    private static final String MAIN_JSON = """
            {
              "messageId": "0b5a0000-aaaa-bbbb-cccc-08dc6a1b2c3d",
              "destinationAddress": "rabbitmq://broker/prod/orders-queue?durable=true",
              "messageType": ["urn:message:Contracts:OrderBase", "urn:message:Contracts:OrderSubmitted"],
              "message": {"processUId": "p-42", "orderId": 17},
              "sentTime": "2024-05-01T10:00:00Z",
              "headers": {"Context": {"userContext": {"UserName": "alice"}}}
            }
            """;

    private static final String HEADERS_JSON = """
            {
              "properties": {"message_id": "0b5a0000"},
              "headers": {
                "Content-Type": "application/vnd.masstransit+json",
                "MT-Fault-ConsumerType": "Orders.OrderConsumer",
                "MT-Fault-ExceptionType": "System.InvalidOperationException",
                "MT-Fault-Message": "Order 17 is locked",
                "MT-Fault-StackTrace": "at Orders.OrderConsumer.Consume()",
                "MT-Fault-Timestamp": "2024-05-01T10:00:05Z"
              }
            }
            """;

    @TempDir
    Path directory;

    private SimpleMeterRegistry meterRegistry;
    private PairedFileDetectionService detectionService;
    private PairedFileReconstructor reconstructor;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        meterRegistry = new SimpleMeterRegistry();
        FilterMetrics metrics = new FilterMetrics(meterRegistry);
        detectionService = new PairedFileDetectionService(objectMapper, FilterEngineProperties.defaults(), metrics);
        reconstructor = new PairedFileReconstructor(objectMapper, detectionService, metrics);
    }

    @AfterEach
    void tearDown() {
        detectionService.shutdown();
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(directory.resolve(name), content);
    }

    // ==================== Complete pair ====================

    @Test
    void shouldReconstructCompletePair() throws IOException {
        Path main = write("msg-42", MAIN_JSON);
        Path headers = write("msg-42-headers+properties.json", HEADERS_JSON);

        Optional<RabbitMqLogEntry> entry = reconstructor.reconstruct(PairedFileData.createComplete(main, headers, "42"));

        assertThat(entry).hasValueSatisfying(e -> {
            assertThat(e.getProcessUid()).isEqualTo("p-42");
            assertThat(e.getUserName()).isEqualTo("alice");
            assertThat(e.getSentTime()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
            assertThat(e.getStackTrace()).isEqualTo("at Orders.OrderConsumer.Consume()");
            assertThat(e.getFaultMessage()).isEqualTo("Order 17 is locked");
            assertThat(e.getFaultTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:05Z"));
            assertThat(e.getEffectiveLevel()).isEqualTo("error");
            assertThat(e.getRawJson()).contains("p-42");
        });
    }

    @Test
    void shouldKeepMainFieldsWhenHeadersFileIsMalformed() throws IOException {
        Path main = write("msg-42", MAIN_JSON);
        Path headers = write("msg-42-headers+properties.json", "{ this is not json");

        Optional<RabbitMqLogEntry> entry = reconstructor.reconstruct(PairedFileData.createComplete(main, headers, "42"));

        assertThat(entry).hasValueSatisfying(e -> {
            assertThat(e.getProcessUid()).isEqualTo("p-42");
            assertThat(e.getStackTrace()).isNull();
            assertThat(e.getFaultMessage()).isNull();
        });
    }

    @Test
    void shouldLeaveAbsentPathsNull() throws IOException {
        Path main = write("msg-8", "{\"sentTime\": \"not a date\"}");
        Path headers = write("msg-8-headers+properties.json", "{\"properties\": {}}");

        Optional<RabbitMqLogEntry> entry = reconstructor.reconstruct(PairedFileData.createComplete(main, headers, "8"));

        assertThat(entry).hasValueSatisfying(e -> {
            assertThat(e.getProcessUid()).isNull();
            assertThat(e.getUserName()).isNull();
            assertThat(e.getSentTime()).isNull();
            assertThat(e.getStackTrace()).isNull();
        });
    }

    // ==================== Unified JSON ====================

    @Test
    void shouldReadUnifiedJsonWithoutHeadersFile() throws IOException {
        Path main = write("msg-5", MAIN_JSON);

        Optional<RabbitMqLogEntry> entry = reconstructor.reconstruct(
                PairedFileData.createPartial(main, "5").withStatus(PairedFileStatus.UNIFIED_JSON));

        assertThat(entry).hasValueSatisfying(e -> {
            assertThat(e.getMessage()).isEqualTo("Contracts:OrderSubmitted");
            assertThat(e.getLevel()).isEqualTo("INFO");
            assertThat(e.getNode()).isEqualTo("orders-queue");
            assertThat(e.getProperties().getMessageId()).isEqualTo("0b5a0000-aaaa-bbbb-cccc-08dc6a1b2c3d");
            assertThat(e.getProcessUid()).isEqualTo("p-42");
            assertThat(e.getUserName()).isEqualTo("alice");
            assertThat(e.getEffectiveStackTrace()).isNull();
        });
    }

    @Test
    void shouldMergeFaultHeadersIntoUnifiedJson() throws IOException {
        Path main = write("msg-5", MAIN_JSON);
        Path headers = write("msg-5-headers+properties.json", HEADERS_JSON);

        Optional<RabbitMqLogEntry> entry = reconstructor.reconstruct(
                PairedFileData.createComplete(main, headers, "5").withStatus(PairedFileStatus.UNIFIED_JSON));

        assertThat(entry).hasValueSatisfying(e -> {
            assertThat(e.getNode()).isEqualTo("Orders.OrderConsumer");
            assertThat(e.getStackTrace()).isEqualTo(
                    "System.InvalidOperationException: Order 17 is locked\nat Orders.OrderConsumer.Consume()");
            assertThat(e.getFaultTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:05Z"));
            assertThat(e.getMessage()).isEqualTo("Contracts:OrderSubmitted");
        });
    }

    @Test
    void shouldFallBackToContentTypeWhenNoMessageType() throws IOException {
        Path main = write("msg-6", """
                {"message": {"processUId": "p-6"}, "sentTime": "2024-05-01T10:00:00Z", "headers": {}}
                """);
        Path headers = write("msg-6-headers+properties.json",
                "{\"headers\": {\"Content-Type\": \"application/json\"}}");

        Optional<RabbitMqLogEntry> entry = reconstructor.reconstruct(
                PairedFileData.createComplete(main, headers, "6").withStatus(PairedFileStatus.UNIFIED_JSON));

        assertThat(entry).hasValueSatisfying(e -> {
            assertThat(e.getMessage()).isEqualTo("Content-Type: application/json");
            assertThat(e.getLevel()).isNull();
        });
    }

    // ==================== Main file only ====================

    @Test
    void shouldDeserializeMainFileOnly() throws IOException {
        Path main = write("msg-77", """
                {"timestamp": "2024-05-01T10:00:00Z", "level": "warning", "node": "rabbit@host-1",
                 "message": "disk alarm set", "unknownField": 1}
                """);

        PairedFileData pair = detectionService.findPairedFile(main);
        Optional<RabbitMqLogEntry> entry = reconstructor.reconstruct(pair);

        assertThat(pair.status()).isEqualTo(PairedFileStatus.PARTIAL);
        assertThat(pair.hasMainFileOnly()).isTrue();
        assertThat(entry).hasValueSatisfying(e -> {
            assertThat(e.getLevel()).isEqualTo("warning");
            assertThat(e.getNode()).isEqualTo("rabbit@host-1");
            assertThat(e.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
            assertThat(e.getEffectiveStackTrace()).isNull();
            assertThat(e.getRawJson()).contains("disk alarm set");
        });
    }

    @Test
    void shouldSkipMalformedMainFile() throws IOException {
        Path main = write("msg-9", "{ broken");

        assertThat(reconstructor.reconstruct(PairedFileData.createPartial(main, "9"))).isEmpty();
        assertThat(reconstructor.reconstruct(PairedFileData.createComplete(main,
                write("msg-9-headers+properties.json", HEADERS_JSON), "9"))).isEmpty();
    }

    @Test
    void shouldProduceNothingForHeadersOnlyOrFailedPairs() throws IOException {
        Path headers = write("msg-3-headers+properties.json", HEADERS_JSON);

        assertThat(reconstructor.reconstruct(PairedFileData.createHeadersOnly(headers, "3"))).isEmpty();
        assertThat(reconstructor.reconstruct(PairedFileData.createFailed("", "Main file path is null or empty"))).isEmpty();
    }

    // ==================== Directory ====================

    @Test
    void shouldLoadDirectorySkippingUnusableIds() throws IOException {
        write("msg-1", MAIN_JSON);
        write("msg-1-headers+properties.json", HEADERS_JSON);
        write("msg-2", "{\"level\": \"info\", \"message\": \"plain\"}");
        write("msg-3", "{ broken");
        write("msg-4-headers+properties.json", HEADERS_JSON);

        List<RabbitMqLogEntry> entries = reconstructor.loadDirectory(directory).toList();

        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).getProcessUid()).isEqualTo("p-42");
        assertThat(entries.get(1).getMessage()).isEqualTo("plain");
        assertThat(meterRegistry.get("rabbitmq.files.reconstructed").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("rabbitmq.files.skipped").counter().count()).isEqualTo(2.0);
    }
}
