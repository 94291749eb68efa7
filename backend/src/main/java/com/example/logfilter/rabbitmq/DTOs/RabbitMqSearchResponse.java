package com.example.logfilter.rabbitmq.DTOs;

import com.example.logfilter.logs.models.RabbitMqLogEntry;

import java.util.List;

public record RabbitMqSearchResponse(
        String description,
        long matched,
        long processed,
        long searchTimeMs,
        boolean truncated,
        List<RabbitMqLogEntry> records) {
}
