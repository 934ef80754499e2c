package com.deepansh.memorychat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Per-turn policy controlling which memory operations may run.
 *
 * <ul>
 *   <li>{@link #NORMAL}: memories are read and written</li>
 *   <li>{@link #INCOGNITO}: memories are neither read nor written</li>
 *   <li>{@link #PAUSE_MEMORIES}: memories are read, nothing new is stored</li>
 * </ul>
 */
public enum PrivacyMode {

    NORMAL("normal"),
    INCOGNITO("incognito"),
    PAUSE_MEMORIES("pause_memories");

    private final String value;

    PrivacyMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean allowsRetrieval() {
        return this != INCOGNITO;
    }

    public boolean allowsStorage() {
        return this == NORMAL;
    }

    @JsonCreator
    public static PrivacyMode fromValue(String value) {
        if (value == null) {
            return NORMAL;
        }
        return Arrays.stream(values())
                .filter(m -> m.value.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown privacy mode: " + value));
    }
}
