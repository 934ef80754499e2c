package com.deepansh.memorychat.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The closed set of pipeline stages, declared in dependency order.
 * Skippable stages may be dropped when the turn's token budget is exhausted.
 */
public enum AgentName {

    PRIVACY_GUARDIAN("PrivacyGuardian", false),
    MEMORY_RETRIEVAL("MemoryRetrieval", true),
    CONVERSATION_GENERATOR("ConversationGenerator", false),
    MEMORY_MANAGER("MemoryManager", true),
    CONVERSATION_ANALYST("ConversationAnalyst", true);

    private final String displayName;
    private final boolean skippable;

    AgentName(String displayName, boolean skippable) {
        this.displayName = displayName;
        this.skippable = skippable;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public boolean isSkippable() {
        return skippable;
    }

    public static AgentName fromDisplayName(String displayName) {
        return Arrays.stream(values())
                .filter(a -> a.displayName.equalsIgnoreCase(displayName) || a.name().equalsIgnoreCase(displayName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + displayName));
    }

    @Override
    public String toString() {
        return displayName;
    }
}
