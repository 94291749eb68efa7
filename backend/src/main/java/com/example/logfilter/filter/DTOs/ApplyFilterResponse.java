package com.example.logfilter.filter.DTOs;

import java.util.List;

public record ApplyFilterResponse<T>(
        String description,
        long matched,
        long processed,
        long durationMs,
        List<T> records) {
}
