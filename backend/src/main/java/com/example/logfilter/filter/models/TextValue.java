package com.example.logfilter.filter.models;

public record TextValue(String text) implements CriterionValue {

    @Override
    public String display() {
        return text;
    }
}
