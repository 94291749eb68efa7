package com.example.logfilter.filter.services;

import java.util.stream.Stream;

/**
 * Lazy filtered stream together with the statistics it updates as it is consumed.
 */
public record FilterRun<T>(Stream<T> records, FilterExecutionInfo info) {
}
