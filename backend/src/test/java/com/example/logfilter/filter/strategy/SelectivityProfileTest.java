package com.example.logfilter.filter.strategy;

import com.example.logfilter.filter.models.CriterionValue;
import com.example.logfilter.filter.models.FilterOperator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class SelectivityProfileTest {

    @Test
    void shouldRateRareLevelsAsMoreSelective() {
        double error = SelectivityProfile.LEVEL.estimate(FilterOperator.EQUALS, CriterionValue.text("ERROR"));
        double warn = SelectivityProfile.LEVEL.estimate(FilterOperator.EQUALS, CriterionValue.text("Warning"));
        double info = SelectivityProfile.LEVEL.estimate(FilterOperator.EQUALS, CriterionValue.text("info"));

        assertThat(error).isEqualTo(0.05);
        assertThat(warn).isEqualTo(0.15);
        assertThat(info).isEqualTo(0.5);
    }

    @Test
    void shouldComplementNegatedOperators() {
        assertThat(SelectivityProfile.LEVEL.estimate(FilterOperator.NOT_EQUALS, CriterionValue.text("error")))
                .isCloseTo(0.95, within(1e-9));
        assertThat(SelectivityProfile.MESSAGE.estimate(FilterOperator.NOT_EQUALS,
                CriterionValue.text("a message longer than twenty chars"))).isCloseTo(0.95, within(1e-9));
        assertThat(SelectivityProfile.PROCESS_UID.estimate(FilterOperator.NOT_EQUALS, CriterionValue.text("abc")))
                .isCloseTo(0.95, within(1e-9));
        assertThat(SelectivityProfile.BASE.estimate(FilterOperator.NOT_IN, CriterionValue.set("a")))
                .isCloseTo(0.6, within(1e-9));
    }

    @Test
    void shouldUseLiteralLengthForMessageContains() {
        assertThat(SelectivityProfile.MESSAGE.estimate(FilterOperator.CONTAINS, CriterionValue.text("ab"))).isEqualTo(0.7);
        assertThat(SelectivityProfile.MESSAGE.estimate(FilterOperator.CONTAINS, CriterionValue.text("timeout"))).isEqualTo(0.4);
        assertThat(SelectivityProfile.MESSAGE.estimate(FilterOperator.CONTAINS, CriterionValue.text("connection refused")))
                .isEqualTo(0.15);
    }

    @Test
    void shouldRankLevelEqualsBelowNodeContains() {
        double level = SelectivityProfile.LEVEL.estimate(FilterOperator.EQUALS, CriterionValue.text("ERROR"));
        double node = SelectivityProfile.NODE.estimate(FilterOperator.CONTAINS, CriterionValue.text("rabbit"));

        assertThat(node).isEqualTo(0.4);
        assertThat(level).isLessThan(node);
    }

    @Test
    void shouldSumLevelFrequenciesForSetMembership() {
        assertThat(SelectivityProfile.LEVEL.estimate(FilterOperator.IN, CriterionValue.set("error", "warn")))
                .isCloseTo(0.2, within(1e-9));
        assertThat(SelectivityProfile.LEVEL.estimate(FilterOperator.IN,
                CriterionValue.set("info", "info", "info"))).isEqualTo(1.0);
    }

    @Test
    void shouldKeepEveryEstimateInUnitInterval() {
        CriterionValue[] values = {
                CriterionValue.text("x"),
                CriterionValue.text("a considerably longer literal value"),
                CriterionValue.set("debug", "info", "trace", "warn"),
                CriterionValue.number(7)
        };
        for (SelectivityProfile profile : SelectivityProfile.values()) {
            for (FilterOperator operator : FilterOperator.values()) {
                for (CriterionValue value : values) {
                    assertThat(profile.estimate(operator, value)).isBetween(0.0, 1.0);
                }
            }
        }
    }
}
