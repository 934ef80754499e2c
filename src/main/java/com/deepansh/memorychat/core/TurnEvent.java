package com.deepansh.memorychat.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * One element of a streamed turn: a single metadata event, then content
 * deltas, then exactly one complete or error event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnEvent(Type type, String content, Map<String, Object> metadata, OrchestrationResult result) {

    public enum Type {
        METADATA, CONTENT, COMPLETE, ERROR;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static TurnEvent metadata(Map<String, Object> metadata) {
        return new TurnEvent(Type.METADATA, null, Map.copyOf(metadata), null);
    }

    public static TurnEvent content(String delta) {
        return new TurnEvent(Type.CONTENT, delta, null, null);
    }

    public static TurnEvent complete(OrchestrationResult result) {
        return new TurnEvent(Type.COMPLETE, null,
                Map.of("memories_extracted", result.getMemoriesExtracted()), result);
    }

    public static TurnEvent error(OrchestrationResult result) {
        return new TurnEvent(Type.ERROR, result.getError() != null ? result.getError().message() : null,
                null, result);
    }
}
