package com.example.logfilter.filter.registry;

import com.example.logfilter.filter.strategy.RegexPatternCache;
import com.example.logfilter.filter.strategy.SelectivityProfile;
import com.example.logfilter.logs.models.RabbitMqLogEntry;

import static com.example.logfilter.filter.models.FilterOperator.*;

/**
 * Filterable fields of reconstructed RabbitMQ messages. Every accessor reads the
 * effective value, so fault headers fill in for missing top-level fields.
 */
public final class RabbitMqLogEntryFields {

    public static final String TIMESTAMP = "Timestamp";
    public static final String LEVEL = "Level";
    public static final String MESSAGE = "Message";
    public static final String NODE = "Node";
    public static final String PROCESS_UID = "ProcessUID";
    public static final String USERNAME = "Username";

    private RabbitMqLogEntryFields() {
    }

    public static FilterStrategyRegistry<RabbitMqLogEntry> registry(RegexPatternCache patternCache) {
        return FilterStrategyRegistry.<RabbitMqLogEntry>builder(RecordKind.RABBITMQ, patternCache)
                .timestampField(TIMESTAMP, RabbitMqLogEntry::getEffectiveTimestamp)
                .textField(LEVEL, RabbitMqLogEntry::getEffectiveLevel, SelectivityProfile.LEVEL,
                        EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, IN, NOT_IN)
                .textField(MESSAGE, RabbitMqLogEntry::getEffectiveMessage, SelectivityProfile.MESSAGE,
                        EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, REGEX)
                .textField(NODE, RabbitMqLogEntry::getEffectiveNode, SelectivityProfile.NODE,
                        EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, IN, NOT_IN)
                .textField(PROCESS_UID, RabbitMqLogEntry::getEffectiveProcessUid, SelectivityProfile.PROCESS_UID,
                        EQUALS, NOT_EQUALS, CONTAINS, STARTS_WITH, ENDS_WITH)
                .textField(USERNAME, RabbitMqLogEntry::getEffectiveUserName, SelectivityProfile.USERNAME,
                        EQUALS, NOT_EQUALS, CONTAINS, STARTS_WITH, ENDS_WITH, IN, NOT_IN)
                .build();
    }
}
