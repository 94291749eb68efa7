package com.example.logfilter.filter.models;

import java.util.List;
import java.util.Objects;

public record TextSetValue(List<String> values) implements CriterionValue {

    public TextSetValue {
        values = values == null
                ? List.of()
                : values.stream().filter(Objects::nonNull).toList();
    }

    @Override
    public String display() {
        return values.toString();
    }
}
