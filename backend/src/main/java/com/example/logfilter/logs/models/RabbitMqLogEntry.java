package com.example.logfilter.logs.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A RabbitMQ log record. Either a flat broker log line, a MassTransit message
 * with transport headers, or a message reconstructed from a paired file set.
 *
 * <p>The {@code effective*} accessors pick the first populated source for a
 * value and return {@code null} when none is available, so filters see the
 * value as missing instead of a made-up default.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RabbitMqLogEntry {
    Instant timestamp;
    String level;
    String message;
    String node;
    String processId;
    String queue;
    String connection;
    String user;
    String virtualHost;

    RabbitMqHeaders headers;
    RabbitMqProperties properties;

    // reconstructed from paired message files
    String processUid;
    String userName;
    Instant sentTime;
    String faultMessage;
    String stackTrace;
    Instant faultTimestamp;

    @JsonIgnore
    String rawJson;

    public Instant getEffectiveTimestamp() {
        if (timestamp != null) {
            return timestamp;
        }
        if (sentTime != null) {
            return sentTime;
        }
        if (faultTimestamp != null) {
            return faultTimestamp;
        }
        return headers != null ? headers.getFaultTimestamp() : null;
    }

    /**
     * The flat level, else {@code "error"} when the message carries fault
     * details, else {@code null}.
     */
    public String getEffectiveLevel() {
        if (level != null) {
            return level;
        }
        boolean faulted = (headers != null && headers.getFaultExceptionType() != null)
                || faultMessage != null
                || stackTrace != null;
        return faulted ? "error" : null;
    }

    public String getEffectiveMessage() {
        if (message != null) {
            return message;
        }
        if (faultMessage != null) {
            return faultMessage;
        }
        return headers != null ? headers.getFaultMessage() : null;
    }

    public String getEffectiveNode() {
        if (node != null) {
            return node;
        }
        return headers != null ? headers.getHostMachineName() : null;
    }

    public String getEffectiveQueue() {
        if (queue != null) {
            return queue;
        }
        return properties != null ? properties.getExchange() : null;
    }

    public String getEffectiveProcessId() {
        if (processId != null) {
            return processId;
        }
        return headers != null ? headers.getHostProcessId() : null;
    }

    public String getEffectiveProcessUid() {
        return processUid;
    }

    public String getEffectiveUserName() {
        return userName != null ? userName : user;
    }

    public String getEffectiveStackTrace() {
        if (stackTrace != null) {
            return stackTrace;
        }
        return headers != null ? headers.getFaultStackTrace() : null;
    }

    public String getEffectiveConsumerType() {
        return headers != null ? headers.getFaultConsumerType() : null;
    }

    @Override
    public String toString() {
        Instant ts = getEffectiveTimestamp();
        String node = getEffectiveNode();
        String message = getEffectiveMessage();
        String level = getEffectiveLevel();
        return "[" + (ts != null ? ts : "Unknown") + "] "
                + (level != null ? level : "Unknown") + " - "
                + (node != null ? node : "Unknown") + ": "
                + (message != null ? message : "No message");
    }
}
