package com.example.logfilter.filter.DTOs;

import com.example.logfilter.filter.models.CombinationMode;
import com.example.logfilter.filter.models.Criterion;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record FilterRequest(
        @NotNull(message = "criteria is required")
        List<Criterion> criteria,
        CombinationMode mode) {
}
