package com.deepansh.memorychat.llm;

import com.deepansh.memorychat.exception.AgentException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    /** Key into {@link #providers}: openai, groq or gemini. */
    private String provider = "groq";

    private Map<String, LlmProviderProperties> providers = new LinkedHashMap<>();

    public LlmProviderProperties active() {
        LlmProviderProperties props = providers.get(provider.toLowerCase());
        if (props == null) {
            throw new AgentException("No settings for LLM provider '" + provider
                    + "'. Configured providers: " + providers.keySet());
        }
        return props;
    }
}
