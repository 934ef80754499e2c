package com.deepansh.memorychat.agent.memory;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum MemoryType {
    FACT(0.6),
    PREFERENCE(0.7),
    EVENT(0.6),
    RELATIONSHIP(0.8),
    OTHER(0.5);

    private final double baseImportance;

    MemoryType(double baseImportance) {
        this.baseImportance = baseImportance;
    }

    public double baseImportance() {
        return baseImportance;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MemoryType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(value.strip()))
                .findFirst();
    }
}
