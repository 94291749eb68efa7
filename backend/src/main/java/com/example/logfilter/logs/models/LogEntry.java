package com.example.logfilter.logs.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Generic log entry produced by the plain-text line parsers.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogEntry {
    Instant timestamp;
    String level;
    String source;
    String message;
    String rawData;
    String correlationId;
    String errorType;
    String filePath;
    Integer lineNumber;
}
