package com.deepansh.memorychat.memory;

import java.util.List;

/**
 * @param memoryType      fact | preference | event | relationship | other
 * @param importanceScore 0.0 to 1.0
 * @param sessionId       session the memory was extracted from
 */
public record MemoryMetadata(String memoryType, double importanceScore, List<String> tags, String sessionId) {

    public MemoryMetadata {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
