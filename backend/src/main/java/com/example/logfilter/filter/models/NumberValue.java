package com.example.logfilter.filter.models;

import java.math.BigDecimal;

public record NumberValue(BigDecimal number) implements CriterionValue {

    @Override
    public String display() {
        return number == null ? "null" : number.toPlainString();
    }
}
