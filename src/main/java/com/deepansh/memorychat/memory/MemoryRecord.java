package com.deepansh.memorychat.memory;

import java.time.Instant;

public record MemoryRecord(String id, String text, MemoryMetadata metadata, Instant createdAt) {
}
