package com.deepansh.memorychat.agent.conversation;

import com.deepansh.memorychat.agent.AbstractAgent;
import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.agent.ErrorKind;
import com.deepansh.memorychat.agent.TokenEstimator;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.exception.ProviderException;
import com.deepansh.memorychat.llm.LlmClient;
import com.deepansh.memorychat.model.LlmResponse;
import com.deepansh.memorychat.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Produces the assistant reply. The injected client is the retrying one, so by
 * the time a ProviderException reaches this class the retry budget is spent
 * (transient) or retrying was pointless (fatal). Either way the stage fails with
 * the provider's error kind and the coordinator ends the turn.
 */
@Component
@Slf4j
public class ConversationGeneratorAgent extends AbstractAgent<GenerationResult> {

    private final LlmClient llmClient;
    private final PromptBuilder promptBuilder;
    private final double temperature;
    private final int maxTokens;

    public ConversationGeneratorAgent(LlmClient llmClient,
                                      PromptBuilder promptBuilder,
                                      OrchestratorProperties properties) {
        this.llmClient = llmClient;
        this.promptBuilder = promptBuilder;
        this.temperature = properties.getGeneration().getTemperature();
        this.maxTokens = properties.getGeneration().getMaxTokens();
    }

    @Override
    public AgentName name() {
        return AgentName.CONVERSATION_GENERATOR;
    }

    @Override
    protected AgentOutput<GenerationResult> process(AgentInput input) {
        List<Message> messages = promptBuilder.build(input);

        LlmResponse response;
        try {
            response = llmClient.complete(messages, temperature, maxTokens);
        } catch (ProviderException e) {
            log.error("Reply generation failed [sessionId={}, kind={}]: {}",
                    input.getSessionId(), e.kind().getValue(), e.getMessage());
            return AgentOutput.failure(e.getMessage(), e.kind());
        }

        String reply = response.getContent();
        if (reply == null || reply.isBlank()) {
            return AgentOutput.failure("Provider returned an empty reply (finish_reason="
                    + response.getFinishReason() + ")", ErrorKind.PROVIDER_FATAL_ERROR);
        }

        int tokens = response.totalTokens() > 0
                ? response.totalTokens()
                : estimatePrompt(messages) + TokenEstimator.estimate(reply);

        log.info("Reply generated [sessionId={}, tokens={}, finishReason={}, memoryContext={}]",
                input.getSessionId(), tokens, response.getFinishReason(), !input.getMemoryContext().isBlank());
        return AgentOutput.success(new GenerationResult(reply, response.getFinishReason()), tokens);
    }

    /**
     * Streaming variant. Each text delta is pushed to {@code deltaSink} as it
     * arrives; the returned output carries the assembled reply.
     */
    public AgentOutput<GenerationResult> executeStreaming(AgentInput input, Consumer<String> deltaSink) {
        return guarded(input, in -> streamReply(in, deltaSink));
    }

    private AgentOutput<GenerationResult> streamReply(AgentInput input, Consumer<String> deltaSink) {
        List<Message> messages = promptBuilder.build(input);
        StringBuilder reply = new StringBuilder();
        AtomicReference<String> finishReason = new AtomicReference<>();

        try {
            llmClient.stream(messages, temperature, maxTokens, chunk -> {
                if (chunk.done()) {
                    finishReason.set(chunk.finishReason());
                    return;
                }
                reply.append(chunk.textDelta());
                deltaSink.accept(chunk.textDelta());
            });
        } catch (ProviderException e) {
            log.error("Streamed generation failed [sessionId={}, kind={}, charsSent={}]: {}",
                    input.getSessionId(), e.kind().getValue(), reply.length(), e.getMessage());
            return AgentOutput.failure(e.getMessage(), e.kind());
        }

        if (reply.length() == 0) {
            return AgentOutput.failure("Provider streamed an empty reply", ErrorKind.PROVIDER_FATAL_ERROR);
        }

        int tokens = estimatePrompt(messages) + TokenEstimator.estimate(reply.toString());
        log.info("Reply streamed [sessionId={}, chars={}, estimatedTokens={}]",
                input.getSessionId(), reply.length(), tokens);
        return AgentOutput.success(new GenerationResult(reply.toString(), finishReason.get()), tokens);
    }

    private int estimatePrompt(List<Message> messages) {
        return messages.stream().mapToInt(m -> TokenEstimator.estimate(m.getContent())).sum();
    }
}
