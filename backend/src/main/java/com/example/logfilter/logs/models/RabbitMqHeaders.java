package com.example.logfilter.logs.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * MassTransit transport headers attached to a RabbitMQ message.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RabbitMqHeaders {
    @JsonProperty("Content-Type") String contentType;
    @JsonProperty("MT-Fault-ConsumerType") String faultConsumerType;
    @JsonProperty("MT-Fault-ExceptionType") String faultExceptionType;
    @JsonProperty("MT-Fault-Message") String faultMessage;
    @JsonProperty("MT-Fault-MessageType") String faultMessageType;
    @JsonProperty("MT-Fault-StackTrace") String faultStackTrace;
    @JsonProperty("MT-Fault-Timestamp") Instant faultTimestamp;
    @JsonProperty("MT-Host-MachineName") String hostMachineName;
    @JsonProperty("MT-Host-ProcessId") String hostProcessId;
    @JsonProperty("MT-Host-ProcessName") String hostProcessName;
    @JsonProperty("MT-Reason") String reason;
}
