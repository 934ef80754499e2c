package com.deepansh.memorychat.agent.retrieval;

import java.util.List;

/**
 * @param memories in the order the store ranked them
 * @param context  prompt-ready block, empty when nothing was found
 */
public record RetrievalResult(List<RetrievedMemory> memories, String context, List<String> warnings) {

    public RetrievalResult {
        memories = List.copyOf(memories);
        warnings = List.copyOf(warnings);
    }

    public static RetrievalResult empty(List<String> warnings) {
        return new RetrievalResult(List.of(), "", warnings);
    }

    public int count() {
        return memories.size();
    }
}
