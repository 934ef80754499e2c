package com.deepansh.memorychat.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    private String content;

    /** stop | length | content_filter, as reported by the provider */
    private String finishReason;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
