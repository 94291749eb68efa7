package com.example.logfilter.filter.expression;

/**
 * Node of a filter tree: either a single criterion or an AND/OR of children.
 */
public interface FilterExpression<T> {

    boolean matches(T record);

    String description();

    double estimatedSelectivity();
}
