package com.example.logfilter.filter.DTOs;

import com.example.logfilter.filter.models.CombinationMode;
import com.example.logfilter.filter.models.Criterion;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Criteria plus an in-memory batch of records to filter.
 */
public record ApplyFilterRequest<T>(
        @NotNull(message = "criteria is required")
        List<Criterion> criteria,
        CombinationMode mode,
        @NotNull(message = "records are required")
        @Size(max = 10000)
        List<T> records) {
}
