package com.deepansh.memorychat.agent.memory;

import java.util.List;

/**
 * @param extracted only the memories the store accepted
 */
public record ExtractionResult(List<SavedMemory> extracted, List<String> warnings) {

    public ExtractionResult {
        extracted = List.copyOf(extracted);
        warnings = List.copyOf(warnings);
    }

    public static ExtractionResult empty(List<String> warnings) {
        return new ExtractionResult(List.of(), warnings);
    }

    public int count() {
        return extracted.size();
    }
}
