package com.deepansh.memorychat.llm;

import com.deepansh.memorychat.exception.ProviderException;
import com.deepansh.memorychat.exception.ProviderFatalException;
import com.deepansh.memorychat.exception.ProviderTransientException;
import com.deepansh.memorychat.model.LlmResponse;
import com.deepansh.memorychat.model.LlmStreamChunk;
import com.deepansh.memorychat.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * OpenAI-compatible chat-completions client. Works with Groq, OpenAI and Gemini.
 *
 * Error mapping:
 *
 * | Error                     | Exception                                   |
 * |---------------------------|---------------------------------------------|
 * | 401 / 403                 | ProviderFatalException (bad or missing key)  |
 * | 400 model_decommissioned  | ProviderFatalException with guidance        |
 * | 408 / 429                 | ProviderTransientException                  |
 * | other 4xx                 | ProviderFatalException                      |
 * | 5xx                       | ProviderTransientException                  |
 * | timeout / network error   | ProviderTransientException                  |
 * | no choices / bad payload  | ProviderFatalException                      |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse complete(List<Message> messages, double temperature, int maxTokens) {
        Map<String, Object> requestBody = buildRequestBody(messages, temperature, maxTokens, false);

        log.debug("Sending {} messages to {} [model={}, temperature={}, maxTokens={}]",
                messages.size(), providerName, props.getModel(), temperature, maxTokens);

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw classifyError(res.getStatusCode().value(), readBody(res));
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (ResourceAccessException e) {
            throw new ProviderTransientException(providerName + " unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void stream(List<Message> messages, double temperature, int maxTokens, Consumer<LlmStreamChunk> sink) {
        Map<String, Object> requestBody = buildRequestBody(messages, temperature, maxTokens, true);

        log.debug("Opening stream to {} [model={}, messages={}]", providerName, props.getModel(), messages.size());

        try {
            restClient.post()
                    .uri("/chat/completions")
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .body(requestBody)
                    .exchange((req, res) -> {
                        if (res.getStatusCode().isError()) {
                            throw classifyError(res.getStatusCode().value(), readBody(res));
                        }
                        readStream(res, sink);
                        return null;
                    });
        } catch (ResourceAccessException e) {
            throw new ProviderTransientException(providerName + " stream failed: " + e.getMessage(), e);
        }
    }

    private void readStream(ClientHttpResponse response, Consumer<LlmStreamChunk> sink) throws IOException {
        String finishReason = null;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LlmStreamChunk chunk = parseStreamLine(line);
                if (chunk == null) {
                    continue;
                }
                if (chunk.done()) {
                    break;
                }
                if (!chunk.textDelta().isEmpty()) {
                    sink.accept(LlmStreamChunk.delta(chunk.textDelta()));
                }
                if (chunk.finishReason() != null) {
                    finishReason = chunk.finishReason();
                }
            }
        }
        sink.accept(LlmStreamChunk.finished(finishReason));
    }

    /**
     * Parses one server-sent-event line. Returns null for blank lines, comments
     * and other non-data fields.
     */
    @SuppressWarnings("unchecked")
    LlmStreamChunk parseStreamLine(String line) {
        if (line == null || !line.startsWith(DATA_PREFIX)) {
            return null;
        }
        String payload = line.substring(DATA_PREFIX.length()).strip();
        if (payload.isEmpty()) {
            return null;
        }
        if (DONE_MARKER.equals(payload)) {
            return LlmStreamChunk.finished(null);
        }

        Map<String, Object> event;
        try {
            event = objectMapper.readValue(payload, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new ProviderFatalException(providerName + " sent a malformed stream chunk", e);
        }

        List<Map<String, Object>> choices = (List<Map<String, Object>>) event.get("choices");
        if (choices == null || choices.isEmpty()) {
            return new LlmStreamChunk("", null, false);
        }
        Map<String, Object> choice = choices.get(0);
        Map<String, Object> delta = (Map<String, Object>) choice.get("delta");
        String content = delta != null ? (String) delta.get("content") : null;
        return new LlmStreamChunk(content != null ? content : "", (String) choice.get("finish_reason"), false);
    }

    /**
     * Maps an HTTP error status to the exception type that tells the retry
     * policy whether another attempt can help.
     */
    ProviderException classifyError(int statusCode, String body) {
        log.error("{} error [status={}]: {}", providerName, statusCode, body);

        if (body != null && body.contains("model_decommissioned")) {
            log.error("Model '{}' is decommissioned by {}. Update llm.providers.{}.model in application.yml.",
                    props.getModel(), providerName, providerName);
            return new ProviderFatalException("Model '" + props.getModel() + "' is decommissioned");
        }
        if (statusCode == 401 || statusCode == 403) {
            return new ProviderFatalException(providerName + " rejected the API key. Check "
                    + providerName.toUpperCase() + "_API_KEY.");
        }
        if (statusCode == 408 || statusCode == 429) {
            return new ProviderTransientException(providerName + " throttled or timed out [" + statusCode + "]");
        }
        if (statusCode >= 500) {
            return new ProviderTransientException(providerName + " server error [" + statusCode + "]: " + body);
        }
        return new ProviderFatalException(providerName + " client error [" + statusCode + "]: " + body);
    }

    private String readBody(ClientHttpResponse response) throws IOException {
        return new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, double temperature,
                                                 int maxTokens, boolean stream) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("messages", messages.stream()
                .map(m -> Map.of(
                        "role", m.getRole().name(),
                        "content", m.getContent() != null ? m.getContent() : ""))
                .toList());
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = response != null
                ? (List<Map<String, Object>>) response.get("choices")
                : null;
        if (choices == null || choices.isEmpty()) {
            throw new ProviderFatalException(providerName + " returned no choices in response");
        }

        int promptTokens = 0;
        int completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
        }

        Map<String, Object> choice = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        String finishReason = (String) choice.get("finish_reason");
        String content = message != null ? (String) message.get("content") : null;

        log.debug("{} completion [finishReason={}, promptTokens={}, completionTokens={}]",
                providerName, finishReason, promptTokens, completionTokens);

        return LlmResponse.builder()
                .content(content != null ? content : "")
                .finishReason(finishReason)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
