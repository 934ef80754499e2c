package com.deepansh.memorychat.agent;

/**
 * Rough token count for text that never went through the provider's tokenizer
 * (retrieved memory blocks, streamed replies). Four characters per token.
 */
public final class TokenEstimator {

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + 3) / 4;
    }
}
