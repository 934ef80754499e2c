package com.deepansh.memorychat.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * One stored memory.
 *
 * Collection: profile_memories
 *
 * Indexes:
 * - namespace (single): every query is namespace-scoped
 * - (namespace, createdAt) compound: recency ordering and cap eviction
 * - (namespace, memoryType) compound: type-filtered listings
 */
@Document(collection = "profile_memories")
@CompoundIndexes({
    @CompoundIndex(name = "idx_ns_date", def = "{'namespace': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "idx_ns_type", def = "{'namespace': 1, 'memoryType': 1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryDocument {

    @Id
    private String id;

    /** userId:profileId */
    @Indexed
    private String namespace;

    private String content;

    private String memoryType;

    private double importanceScore;

    private List<String> tags;

    private String sourceSessionId;

    @CreatedDate
    private Instant createdAt;

    public MemoryRecord toRecord() {
        return new MemoryRecord(id, content,
                new MemoryMetadata(memoryType, importanceScore, tags, sourceSessionId), createdAt);
    }
}
