package com.example.logfilter.filter.models;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Literal bound to a filter criterion. The set of variants is closed: every
 * strategy validates and matches against exactly these four shapes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextValue.class, name = "text"),
        @JsonSubTypes.Type(value = TextSetValue.class, name = "set"),
        @JsonSubTypes.Type(value = NumberValue.class, name = "number"),
        @JsonSubTypes.Type(value = DateRangeValue.class, name = "dateRange")
})
public interface CriterionValue {

    /**
     * Rendering used in expression descriptions.
     */
    String display();

    static TextValue text(String text) {
        return new TextValue(text);
    }

    static TextSetValue set(String... values) {
        return new TextSetValue(Arrays.asList(values));
    }

    static NumberValue number(long number) {
        return new NumberValue(BigDecimal.valueOf(number));
    }

    static DateRangeValue range(Instant from, Instant to) {
        return new DateRangeValue(from, to);
    }

    static TextSetValue set(List<String> values) {
        return new TextSetValue(values);
    }
}
