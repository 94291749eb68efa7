package com.example.logfilter.logs.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One line of an IIS W3C extended log.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class IisLogEntry {
    Instant dateTime;
    String clientIpAddress;
    String userName;
    String serviceName;
    String serverName;
    String serverIpAddress;
    Integer serverPort;
    String method;
    String uriStem;
    String uriQuery;
    Integer httpStatus;
    Integer win32Status;
    Long bytesSent;
    Long bytesReceived;
    Integer timeTaken;
    String protocolVersion;
    String host;
    String userAgent;
    String cookie;
    String rawLine;
}
