package com.example.logfilter.filter.expression;

import com.example.logfilter.filter.models.CombinationMode;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * AND/OR over child expressions, evaluated in child order with short-circuit.
 * An empty AND matches every record, an empty OR matches none.
 */
public final class FilterComposite<T> implements FilterExpression<T> {

    private final CombinationMode mode;
    private final List<FilterExpression<T>> children;

    public FilterComposite(CombinationMode mode, List<? extends FilterExpression<T>> children) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    public CombinationMode mode() {
        return mode;
    }

    public List<FilterExpression<T>> children() {
        return children;
    }

    /**
     * Same mode, different child order or content.
     */
    public FilterComposite<T> withChildren(List<? extends FilterExpression<T>> newChildren) {
        return new FilterComposite<>(mode, newChildren);
    }

    @Override
    public boolean matches(T record) {
        if (mode == CombinationMode.AND) {
            for (FilterExpression<T> child : children) {
                if (!child.matches(record)) {
                    return false;
                }
            }
            return true;
        }
        for (FilterExpression<T> child : children) {
            if (child.matches(record)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String description() {
        if (children.isEmpty()) {
            return mode + "()";
        }
        return children.stream()
                .map(child -> "(" + child.description() + ")")
                .collect(Collectors.joining(" " + mode + " "));
    }

    /**
     * AND multiplies the children's estimates, OR combines them as independent
     * events. Empty composites follow their match-all / match-none policy.
     */
    @Override
    public double estimatedSelectivity() {
        if (mode == CombinationMode.AND) {
            double product = 1.0;
            for (FilterExpression<T> child : children) {
                product *= child.estimatedSelectivity();
            }
            return product;
        }
        double noneMatch = 1.0;
        for (FilterExpression<T> child : children) {
            noneMatch *= 1.0 - child.estimatedSelectivity();
        }
        return 1.0 - noneMatch;
    }

    @Override
    public String toString() {
        return description();
    }
}
