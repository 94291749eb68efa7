package com.example.logfilter.filter.registry;

import com.example.logfilter.filter.strategy.RegexPatternCache;
import com.example.logfilter.filter.strategy.SelectivityProfile;
import com.example.logfilter.logs.models.IisLogEntry;

/**
 * W3C extended IIS log fields. Text fields take the full text operator set,
 * status codes and sizes compare numerically.
 */
public final class IisLogEntryFields {

    private IisLogEntryFields() {
    }

    public static FilterStrategyRegistry<IisLogEntry> registry(RegexPatternCache patternCache) {
        return FilterStrategyRegistry.<IisLogEntry>builder(RecordKind.IIS, patternCache)
                .timestampField("Timestamp", IisLogEntry::getDateTime)
                .textField("ClientIP", IisLogEntry::getClientIpAddress, SelectivityProfile.NODE)
                .textField("ServerIP", IisLogEntry::getServerIpAddress, SelectivityProfile.NODE)
                .textField("Method", IisLogEntry::getMethod, SelectivityProfile.BASE)
                .textField("UriStem", IisLogEntry::getUriStem, SelectivityProfile.MESSAGE)
                .textField("UriQuery", IisLogEntry::getUriQuery, SelectivityProfile.MESSAGE)
                .textField("UserName", IisLogEntry::getUserName, SelectivityProfile.USERNAME)
                .textField("UserAgent", IisLogEntry::getUserAgent, SelectivityProfile.MESSAGE)
                .textField("Host", IisLogEntry::getHost, SelectivityProfile.NODE)
                .numericField("HttpStatus", IisLogEntry::getHttpStatus)
                .numericField("Win32Status", IisLogEntry::getWin32Status)
                .numericField("ServerPort", IisLogEntry::getServerPort)
                .numericField("TimeTaken", IisLogEntry::getTimeTaken)
                .numericField("BytesSent", IisLogEntry::getBytesSent)
                .build();
    }
}
