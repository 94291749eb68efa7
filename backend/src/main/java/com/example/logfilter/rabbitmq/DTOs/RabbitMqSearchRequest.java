package com.example.logfilter.rabbitmq.DTOs;

import com.example.logfilter.filter.models.CombinationMode;
import com.example.logfilter.filter.models.Criterion;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record RabbitMqSearchRequest(
        @NotBlank(message = "directory is required")
        String directory,
        List<Criterion> criteria,
        CombinationMode mode,
        @Positive(message = "limit must be positive")
        Integer limit) {
}
