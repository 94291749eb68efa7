package com.example.logfilter.config;

import com.example.logfilter.filter.expression.SelectivityOptimizer;
import com.example.logfilter.filter.registry.FilterStrategyRegistry;
import com.example.logfilter.filter.registry.IisLogEntryFields;
import com.example.logfilter.filter.registry.LogEntryFields;
import com.example.logfilter.filter.registry.RabbitMqLogEntryFields;
import com.example.logfilter.filter.services.FilterService;
import com.example.logfilter.filter.strategy.RegexPatternCache;
import com.example.logfilter.logs.models.IisLogEntry;
import com.example.logfilter.logs.models.LogEntry;
import com.example.logfilter.logs.models.RabbitMqLogEntry;
import com.example.logfilter.metrics.FilterMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds one strategy registry and one filter service per record kind. All
 * registries share a single regex cache.
 */
@Slf4j
@Configuration
public class FilterEngineConfig {

    @Bean
    public RegexPatternCache regexPatternCache(FilterEngineProperties properties) {
        log.info("Regex pattern cache capacity: {}", properties.regexCacheCapacity());
        return new RegexPatternCache(properties.regexCacheCapacity());
    }

    @Bean
    public FilterStrategyRegistry<LogEntry> logEntryRegistry(RegexPatternCache patternCache) {
        return LogEntryFields.registry(patternCache);
    }

    @Bean
    public FilterStrategyRegistry<IisLogEntry> iisLogEntryRegistry(RegexPatternCache patternCache) {
        return IisLogEntryFields.registry(patternCache);
    }

    @Bean
    public FilterStrategyRegistry<RabbitMqLogEntry> rabbitMqLogEntryRegistry(RegexPatternCache patternCache) {
        return RabbitMqLogEntryFields.registry(patternCache);
    }

    @Bean
    public FilterService<LogEntry> logEntryFilterService(FilterStrategyRegistry<LogEntry> logEntryRegistry,
                                                         SelectivityOptimizer optimizer,
                                                         FilterMetrics metrics) {
        return new FilterService<>(logEntryRegistry, optimizer, metrics);
    }

    @Bean
    public FilterService<IisLogEntry> iisLogEntryFilterService(FilterStrategyRegistry<IisLogEntry> iisLogEntryRegistry,
                                                               SelectivityOptimizer optimizer,
                                                               FilterMetrics metrics) {
        return new FilterService<>(iisLogEntryRegistry, optimizer, metrics);
    }

    @Bean
    public FilterService<RabbitMqLogEntry> rabbitMqLogEntryFilterService(
            FilterStrategyRegistry<RabbitMqLogEntry> rabbitMqLogEntryRegistry,
            SelectivityOptimizer optimizer,
            FilterMetrics metrics) {
        return new FilterService<>(rabbitMqLogEntryRegistry, optimizer, metrics);
    }
}
