package com.example.logfilter.filter.registry;

import com.example.logfilter.filter.strategy.RegexPatternCache;
import com.example.logfilter.filter.strategy.SelectivityProfile;
import com.example.logfilter.logs.models.LogEntry;

import static com.example.logfilter.filter.models.FilterOperator.*;

public final class LogEntryFields {

    private LogEntryFields() {
    }

    public static FilterStrategyRegistry<LogEntry> registry(RegexPatternCache patternCache) {
        return FilterStrategyRegistry.<LogEntry>builder(RecordKind.GENERIC, patternCache)
                .timestampField("Timestamp", LogEntry::getTimestamp)
                .textField("Level", LogEntry::getLevel, SelectivityProfile.LEVEL,
                        EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, IN, NOT_IN)
                .textField("Message", LogEntry::getMessage, SelectivityProfile.MESSAGE,
                        EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, REGEX)
                .textField("Source", LogEntry::getSource, SelectivityProfile.NODE,
                        EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, REGEX)
                .textField("RawData", LogEntry::getRawData, SelectivityProfile.MESSAGE,
                        EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, REGEX)
                .textField("CorrelationId", LogEntry::getCorrelationId, SelectivityProfile.PROCESS_UID,
                        EQUALS, NOT_EQUALS, CONTAINS, STARTS_WITH, ENDS_WITH)
                .textField("ErrorType", LogEntry::getErrorType, SelectivityProfile.BASE,
                        EQUALS, NOT_EQUALS, CONTAINS, IN, NOT_IN)
                .build();
    }
}
