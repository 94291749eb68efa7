package com.example.logfilter.filter;

import com.example.logfilter.filter.DTOs.ApplyFilterRequest;
import com.example.logfilter.filter.DTOs.ApplyFilterResponse;
import com.example.logfilter.filter.DTOs.FilterRequest;
import com.example.logfilter.filter.models.ValidationResult;
import com.example.logfilter.filter.registry.RecordKind;
import com.example.logfilter.filter.services.FilterCancellation;
import com.example.logfilter.filter.services.FilterRun;
import com.example.logfilter.filter.services.FilterService;
import com.example.logfilter.logs.models.IisLogEntry;
import com.example.logfilter.logs.models.LogEntry;
import com.example.logfilter.logs.models.RabbitMqLogEntry;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

@Slf4j
@RestController
@RequestMapping("/api/v1/filters")
public class FilterController {

    private final FilterService<LogEntry> logEntryFilterService;
    private final FilterService<IisLogEntry> iisLogEntryFilterService;
    private final Map<RecordKind, FilterService<?>> servicesByKind = new EnumMap<>(RecordKind.class);

    public FilterController(
            FilterService<LogEntry> logEntryFilterService,
            FilterService<IisLogEntry> iisLogEntryFilterService,
            FilterService<RabbitMqLogEntry> rabbitMqLogEntryFilterService) {
        this.logEntryFilterService = logEntryFilterService;
        this.iisLogEntryFilterService = iisLogEntryFilterService;
        servicesByKind.put(RecordKind.GENERIC, logEntryFilterService);
        servicesByKind.put(RecordKind.IIS, iisLogEntryFilterService);
        servicesByKind.put(RecordKind.RABBITMQ, rabbitMqLogEntryFilterService);
    }

    @GetMapping("/{kind}/fields")
    public List<String> getFields(@PathVariable String kind) {
        return serviceFor(kind).availableFields();
    }

    @GetMapping("/{kind}/fields/{field}/operators")
    public List<String> getOperators(@PathVariable String kind, @PathVariable String field) {
        List<String> operators = serviceFor(kind).availableOperators(field);
        if (operators.isEmpty()) {
            throw UnsupportedFieldOrOperatorException.unknownField(field);
        }
        return operators;
    }

    /**
     * Always answers 200; the body says whether the criteria are usable.
     */
    @PostMapping("/{kind}/validate")
    public ValidationResult validate(@PathVariable String kind, @Valid @RequestBody FilterRequest request) {
        ValidationResult result = serviceFor(kind).validate(request.criteria());
        log.info("Validated {} criteria for {}: {}", request.criteria().size(), kind, result);
        return result;
    }

    @PostMapping("/generic/apply")
    public ResponseEntity<ApplyFilterResponse<LogEntry>> applyGeneric(
            @Valid @RequestBody ApplyFilterRequest<LogEntry> request) {
        return ResponseEntity.ok(apply(logEntryFilterService, request));
    }

    @PostMapping("/iis/apply")
    public ResponseEntity<ApplyFilterResponse<IisLogEntry>> applyIis(
            @Valid @RequestBody ApplyFilterRequest<IisLogEntry> request) {
        return ResponseEntity.ok(apply(iisLogEntryFilterService, request));
    }

    private <T> ApplyFilterResponse<T> apply(FilterService<T> service, ApplyFilterRequest<T> request) {
        FilterRun<T> run = service.run(request.criteria(), request.mode(), request.records().stream(),
                FilterCancellation.none());

        List<T> matched;
        try (Stream<T> records = run.records()) {
            matched = records.toList();
        }

        log.info("Applied {} filter [{}]: {}/{} records matched in {}ms",
                service.kind(),
                run.info().getDescription(),
                run.info().getItemsMatched(),
                run.info().getItemsProcessed(),
                run.info().getElapsed().toMillis());

        return new ApplyFilterResponse<>(
                run.info().getDescription(),
                run.info().getItemsMatched(),
                run.info().getItemsProcessed(),
                run.info().getElapsed().toMillis(),
                matched);
    }

    private FilterService<?> serviceFor(String kind) {
        return RecordKind.fromPathName(kind)
                .map(servicesByKind::get)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown record kind: " + kind));
    }
}
