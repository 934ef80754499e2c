package com.deepansh.memorychat.agent;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

/**
 * Uniform result of one stage invocation.
 *
 * A failed output never carries data and always carries an error; a successful
 * one never carries an error. The static factories are the only way to build
 * one, so the two shapes cannot be mixed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AgentOutput<T> {

    boolean success;
    T data;
    int tokensUsed;
    @With
    long executionTimeMs;
    AgentError error;

    public static <T> AgentOutput<T> success(T data, int tokensUsed) {
        return new AgentOutput<>(true, data, Math.max(0, tokensUsed), 0L, null);
    }

    public static <T> AgentOutput<T> failure(String message, ErrorKind kind) {
        return failure(message, kind, 0);
    }

    public static <T> AgentOutput<T> failure(String message, ErrorKind kind, int tokensUsed) {
        return new AgentOutput<>(false, null, Math.max(0, tokensUsed), 0L, new AgentError(message, kind));
    }
}
