package com.deepansh.memorychat.agent.memory;

import java.util.List;

public record ExtractedMemory(String content, double importanceScore, MemoryType memoryType, List<String> tags) {

    public ExtractedMemory {
        tags = List.copyOf(tags);
    }
}
