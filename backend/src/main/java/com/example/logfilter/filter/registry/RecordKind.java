package com.example.logfilter.filter.registry;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum RecordKind {
    GENERIC("generic"),
    IIS("iis"),
    RABBITMQ("rabbitmq");

    private final String pathName;

    RecordKind(String pathName) {
        this.pathName = pathName;
    }

    public String pathName() {
        return pathName;
    }

    public static Optional<RecordKind> fromPathName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.pathName.equals(normalized))
                .findFirst();
    }
}
