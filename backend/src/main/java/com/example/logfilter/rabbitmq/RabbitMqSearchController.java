package com.example.logfilter.rabbitmq;

import com.example.logfilter.config.FilterEngineProperties;
import com.example.logfilter.filter.services.FilterCancellation;
import com.example.logfilter.filter.services.FilterRun;
import com.example.logfilter.filter.services.FilterService;
import com.example.logfilter.logs.models.RabbitMqLogEntry;
import com.example.logfilter.rabbitmq.DTOs.RabbitMqSearchRequest;
import com.example.logfilter.rabbitmq.DTOs.RabbitMqSearchResponse;
import com.example.logfilter.rabbitmq.models.PairedFileData;
import com.example.logfilter.rabbitmq.services.PairedFileDetectionService;
import com.example.logfilter.rabbitmq.services.PairedFileReconstructor;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Searches RabbitMQ message dumps on the server's file system.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/rabbitmq")
public class RabbitMqSearchController {

    private final PairedFileDetectionService detectionService;
    private final PairedFileReconstructor reconstructor;
    private final FilterService<RabbitMqLogEntry> filterService;
    private final FilterEngineProperties properties;

    public RabbitMqSearchController(
            PairedFileDetectionService detectionService,
            PairedFileReconstructor reconstructor,
            FilterService<RabbitMqLogEntry> rabbitMqLogEntryFilterService,
            FilterEngineProperties properties) {
        this.detectionService = detectionService;
        this.reconstructor = reconstructor;
        this.filterService = rabbitMqLogEntryFilterService;
        this.properties = properties;
    }

    @PostMapping("/search")
    public ResponseEntity<RabbitMqSearchResponse> search(@Valid @RequestBody RabbitMqSearchRequest request) {
        int limit = request.limit() == null
                ? properties.maxSearchResults()
                : Math.min(request.limit(), properties.maxSearchResults());

        log.info("RabbitMQ search request: directory={}, criteria={}, mode={}, limit={}",
                request.directory(), request.criteria(), request.mode(), limit);

        FilterRun<RabbitMqLogEntry> run = filterService.run(
                request.criteria(),
                request.mode(),
                reconstructor.loadDirectory(Path.of(request.directory())),
                FilterCancellation.none());

        List<RabbitMqLogEntry> records;
        try (Stream<RabbitMqLogEntry> matches = run.records()) {
            records = new ArrayList<>(matches.limit(limit + 1L).toList());
        }
        boolean truncated = records.size() > limit;
        if (truncated) {
            records.remove(records.size() - 1);
        }

        log.info("RabbitMQ search completed: {} results from {} messages in {}ms{}",
                records.size(),
                run.info().getItemsProcessed(),
                run.info().getElapsed().toMillis(),
                truncated ? " (truncated)" : "");

        return ResponseEntity.ok(new RabbitMqSearchResponse(
                run.info().getDescription(),
                records.size(),
                run.info().getItemsProcessed(),
                run.info().getElapsed().toMillis(),
                truncated,
                records));
    }

    @GetMapping("/pairs")
    public List<PairedFileData> getPairs(@RequestParam String directory) {
        List<PairedFileData> pairs = detectionService.detectPairedFiles(Path.of(directory)).toList();
        log.info("Detected {} message ids in {}", pairs.size(), directory);
        return pairs;
    }
}
