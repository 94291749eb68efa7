package com.example.logfilter.logs.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RabbitMqProperties {
    @JsonProperty("content_type") String contentType;
    @JsonProperty("delivery_mode") Integer deliveryMode;
    @JsonProperty("exchange") String exchange;
    @JsonProperty("message_id") String messageId;
    @JsonProperty("priority") Integer priority;
}
