package com.example.logfilter.filter.expression;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Reorders composite children by ascending estimated selectivity so that the
 * most selective checks run first. The sort is stable and applied recursively;
 * leaves are returned as-is and no node is copied except the composites.
 */
@Slf4j
@Component
public class SelectivityOptimizer {

    public <T> FilterExpression<T> optimize(FilterExpression<T> expression) {
        if (!(expression instanceof FilterComposite<T> composite)) {
            return expression;
        }

        List<Ranked<T>> ranked = composite.children().stream()
                .map(this::optimize)
                .map(child -> new Ranked<>(child, child.estimatedSelectivity()))
                .toList();

        List<FilterExpression<T>> ordered = ranked.stream()
                .sorted(Comparator.comparingDouble(Ranked::selectivity))
                .map(Ranked::expression)
                .toList();

        FilterComposite<T> optimized = composite.withChildren(ordered);
        log.debug("Optimized {} -> {}", composite.description(), optimized.description());
        return optimized;
    }

    private record Ranked<T>(FilterExpression<T> expression, double selectivity) {
    }
}
