package com.deepansh.memorychat.agent.memory;

import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.llm.LlmClient;
import com.deepansh.memorychat.model.LlmResponse;
import com.deepansh.memorychat.model.Message;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns one completed exchange into candidate memories.
 *
 * Key design decisions:
 *
 * 1. Uses "activeLlmClient" directly, bypassing the retrying client. A slow or
 *    failing extraction must never eat into the reply's retry budget.
 *
 * 2. Has its own circuit breaker ("memoryExtraction"). When it is open the call
 *    is rejected with CallNotPermittedException and the caller skips storage.
 *
 * 3. Three guards before JSON parsing (blank, fenced, not an array) so a prose
 *    answer yields no memories instead of an exception.
 *
 * 4. Every candidate is normalised: importance clamped or estimated, type and
 *    tags inferred when missing, duplicates dropped.
 */
@Component
@Slf4j
public class MemoryExtractor {

    public static final String CIRCUIT_BREAKER_NAME = "memoryExtraction";

    private static final String SYSTEM_INSTRUCTION =
            "You are a memory extraction assistant. Output only valid JSON arrays. Nothing else.";

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final double temperature;
    private final int maxTokens;

    @Autowired
    public MemoryExtractor(@Qualifier("activeLlmClient") LlmClient llmClient,
                           ObjectMapper objectMapper,
                           CircuitBreakerRegistry circuitBreakerRegistry,
                           OrchestratorProperties properties) {
        this(llmClient, objectMapper, circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME), properties);
    }

    public MemoryExtractor(LlmClient llmClient,
                           ObjectMapper objectMapper,
                           CircuitBreaker circuitBreaker,
                           OrchestratorProperties properties) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.temperature = properties.getExtraction().getTemperature();
        this.maxTokens = properties.getExtraction().getMaxTokens();
    }

    public record Extraction(List<ExtractedMemory> memories, int tokensUsed) {
    }

    /**
     * @throws com.deepansh.memorychat.exception.ProviderException           when the provider call fails
     * @throws io.github.resilience4j.circuitbreaker.CallNotPermittedException when the breaker is open
     */
    public Extraction extract(String userMessage, String assistantReply) {
        List<Message> prompt = List.of(
                Message.system(SYSTEM_INSTRUCTION),
                Message.user(buildPrompt(userMessage, assistantReply)));

        LlmResponse response = circuitBreaker.executeSupplier(
                () -> llmClient.complete(prompt, temperature, maxTokens));

        List<ExtractedMemory> memories = normalise(parse(response.getContent()));
        log.debug("Extraction produced {} candidate memories [tokens={}]", memories.size(), response.totalTokens());
        return new Extraction(memories, response.totalTokens());
    }

    List<RawMemory> parse(String raw) {
        // Guard 1: null/blank
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        String cleaned = raw.strip()
                .replaceAll("(?s)^```json\\s*", "")
                .replaceAll("(?s)^```\\s*", "")
                .replaceAll("(?s)```\\s*$", "")
                .strip();

        // Guard 2: not a JSON array
        if (!cleaned.startsWith("[")) {
            log.warn("Extraction response is not a JSON array, skipping. First 100 chars: '{}'",
                    cleaned.substring(0, Math.min(100, cleaned.length())));
            return List.of();
        }

        // Guard 3: parse defensively
        try {
            return objectMapper.readValue(cleaned, new TypeReference<List<RawMemory>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse extraction JSON, skipping. Error: {}", e.getMessage());
            return List.of();
        }
    }

    List<ExtractedMemory> normalise(List<RawMemory> raw) {
        List<ExtractedMemory> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (RawMemory candidate : raw) {
            if (candidate == null || candidate.content() == null || candidate.content().isBlank()) {
                continue;
            }
            String content = candidate.content().strip();
            if (!seen.add(content.toLowerCase(Locale.ROOT))) {
                continue;
            }

            MemoryType type = MemoryType.parse(candidate.memoryType())
                    .orElseGet(() -> MemoryHeuristics.categorize(content));
            double importance = candidate.importanceScore() != null
                    ? MemoryHeuristics.round(MemoryHeuristics.clamp(candidate.importanceScore()))
                    : MemoryHeuristics.importance(content, type);
            List<String> tags = candidate.tags() != null && !candidate.tags().isEmpty()
                    ? candidate.tags().stream()
                            .filter(t -> t != null && !t.isBlank())
                            .map(t -> t.strip().toLowerCase(Locale.ROOT))
                            .distinct()
                            .limit(MemoryHeuristics.MAX_TAGS)
                            .toList()
                    : MemoryHeuristics.generateTags(content, type);

            result.add(new ExtractedMemory(content, importance, type, tags));
        }
        return result;
    }

    private String buildPrompt(String userMessage, String assistantReply) {
        return """
                Analyze the following conversation and extract important information that should be remembered.

                Conversation:
                User: %s
                Assistant: %s

                Extract memories as a JSON array. Each memory should have:
                - "content": clear, concise statement of what to remember
                - "importance_score": number from 0.0 to 1.0 (higher = more important)
                - "memory_type": one of fact, preference, event, relationship, other
                - "tags": array of relevant keywords

                Only extract information that is explicitly stated or clearly implied,
                relevant for future conversations, and not trivial or temporary.

                Respond with ONLY a JSON array. No explanation, no markdown, no prose. Example:
                [
                  {"content": "Works as a Java backend developer", "importance_score": 0.7, "memory_type": "fact", "tags": ["work", "java"]}
                ]
                If nothing is worth remembering, respond with exactly: []
                """.formatted(userMessage, assistantReply);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RawMemory(String content,
                     @JsonProperty("importance_score") Double importanceScore,
                     @JsonProperty("memory_type") String memoryType,
                     List<String> tags) {
    }
}
