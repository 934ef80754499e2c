package com.deepansh.memorychat.llm;

import lombok.Data;

/**
 * Connection settings for one OpenAI-compatible provider.
 * Sampling parameters are per call, not per provider.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
}
