package com.deepansh.memorychat.resilience;

import com.deepansh.memorychat.exception.ProviderFatalException;
import com.deepansh.memorychat.exception.ProviderTransientException;
import com.deepansh.memorychat.llm.LlmClient;
import com.deepansh.memorychat.model.LlmResponse;
import com.deepansh.memorychat.model.LlmStreamChunk;
import com.deepansh.memorychat.model.Message;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Decorator around the active provider client that adds bounded retry.
 *
 * Retry config (resilience4j.retry.instances.llmClient in application.yml):
 * - 3 attempts, exponential backoff 1s, 2s
 * - retries ProviderTransientException only; ProviderFatalException fails at once
 *
 * When attempts run out the last ProviderTransientException is rethrown, so the
 * caller can still tell an exhausted transient failure from a fatal one.
 *
 * A stream is only retried while nothing has been delivered to the sink. Once a
 * delta has gone out, replaying the request would duplicate text, so a later
 * transient failure is escalated to ProviderFatalException.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    public static final String RETRY_NAME = "llmClient";

    private final LlmClient delegate;
    private final Retry retry;

    @Autowired
    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate, RetryRegistry retryRegistry) {
        this(delegate, retryRegistry.retry(RETRY_NAME));
    }

    public ResilientLlmClient(LlmClient delegate, Retry retry) {
        this.delegate = delegate;
        this.retry = retry;
        retry.getEventPublisher()
                .onRetry(e -> log.warn("LLM call failed, retrying [attempt={}, wait={}ms]: {}",
                        e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                        e.getLastThrowable().getMessage()))
                .onError(e -> log.error("LLM call failed after {} attempts: {}",
                        e.getNumberOfRetryAttempts(), e.getLastThrowable().getMessage()));
    }

    @Override
    public LlmResponse complete(List<Message> messages, double temperature, int maxTokens) {
        return Retry.decorateSupplier(retry, () -> delegate.complete(messages, temperature, maxTokens)).get();
    }

    @Override
    public void stream(List<Message> messages, double temperature, int maxTokens, Consumer<LlmStreamChunk> sink) {
        AtomicBoolean emitted = new AtomicBoolean(false);
        Consumer<LlmStreamChunk> tracking = chunk -> {
            if (!chunk.done()) {
                emitted.set(true);
            }
            sink.accept(chunk);
        };

        Retry.decorateRunnable(retry, () -> {
            try {
                delegate.stream(messages, temperature, maxTokens, tracking);
            } catch (ProviderTransientException e) {
                if (emitted.get()) {
                    throw new ProviderFatalException("Stream interrupted after partial output: " + e.getMessage(), e);
                }
                throw e;
            }
        }).run();
    }
}
