package com.deepansh.memorychat.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw provider client selected by {@code llm.provider}.
 *
 * The conversation path goes through {@link com.deepansh.memorychat.resilience.ResilientLlmClient}
 * (primary bean); memory extraction injects "activeLlmClient" directly so it
 * never consumes the conversation retry budget.
 */
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
@Slf4j
public class LlmClientConfig {

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(LlmProperties llmProperties,
                                     ObjectMapper objectMapper,
                                     @Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        String provider = llmProperties.getProvider().toLowerCase();
        LlmProviderProperties props = llmProperties.active();

        log.info("Active LLM provider [provider={}, model={}, baseUrl={}]",
                provider, props.getModel(), props.getBaseUrl());
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            log.error("API key for provider '{}' is not set. Set {}_API_KEY in the environment.",
                    provider, provider.toUpperCase());
        }

        return new GenericLlmClient(props, objectMapper, provider, builder.clone());
    }
}
