package com.deepansh.memorychat.memory;

import java.util.List;

/**
 * Long-term memory store shared by all turns. Ranking and per-namespace
 * isolation are the store's job; callers only shape the request.
 *
 * Both operations throw {@link com.deepansh.memorychat.exception.MemoryStoreException}
 * when the backing store is unavailable.
 */
public interface MemoryStore {

    /** Most relevant first, at most {@code limit} entries. */
    List<MemoryRecord> search(String namespace, String query, int limit);

    /** Appends one memory and returns its id. */
    String add(String namespace, String text, MemoryMetadata metadata);
}
