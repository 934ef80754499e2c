package com.deepansh.memorychat.model;

/**
 * One incremental piece of a streamed completion. The last chunk of a stream
 * has {@code done=true} and carries the finish reason when the provider sent one.
 */
public record LlmStreamChunk(String textDelta, String finishReason, boolean done) {

    public static LlmStreamChunk delta(String text) {
        return new LlmStreamChunk(text, null, false);
    }

    public static LlmStreamChunk finished(String finishReason) {
        return new LlmStreamChunk("", finishReason, true);
    }
}
