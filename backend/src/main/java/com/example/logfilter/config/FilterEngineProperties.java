package com.example.logfilter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs for the filter engine, bound from {@code log-filter.*}.
 * Non-positive values fall back to the defaults.
 */
@ConfigurationProperties(prefix = "log-filter")
public record FilterEngineProperties(
        int regexCacheCapacity,
        int scanParallelism,
        int maxSearchResults
) {
    public static final int DEFAULT_REGEX_CACHE_CAPACITY = 50;
    public static final int DEFAULT_MAX_SEARCH_RESULTS = 1000;

    public FilterEngineProperties {
        if (regexCacheCapacity <= 0) {
            regexCacheCapacity = DEFAULT_REGEX_CACHE_CAPACITY;
        }
        if (scanParallelism <= 0) {
            scanParallelism = Runtime.getRuntime().availableProcessors();
        }
        if (maxSearchResults <= 0) {
            maxSearchResults = DEFAULT_MAX_SEARCH_RESULTS;
        }
    }

    public static FilterEngineProperties defaults() {
        return new FilterEngineProperties(0, 0, 0);
    }
}
