package com.deepansh.memorychat.agent.memory;

public record SavedMemory(String id, ExtractedMemory memory) {
}
