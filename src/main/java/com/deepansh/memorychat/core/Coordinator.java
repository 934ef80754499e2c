package com.deepansh.memorychat.core;

import com.deepansh.memorychat.agent.AgentError;
import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.agent.ErrorKind;
import com.deepansh.memorychat.agent.analysis.AnalysisReport;
import com.deepansh.memorychat.agent.analysis.ConversationAnalystAgent;
import com.deepansh.memorychat.agent.conversation.ConversationGeneratorAgent;
import com.deepansh.memorychat.agent.conversation.GenerationResult;
import com.deepansh.memorychat.agent.memory.ExtractionResult;
import com.deepansh.memorychat.agent.memory.MemoryManagerAgent;
import com.deepansh.memorychat.agent.privacy.PrivacyGuardianAgent;
import com.deepansh.memorychat.agent.privacy.PrivacyVerdict;
import com.deepansh.memorychat.agent.retrieval.MemoryRetrievalAgent;
import com.deepansh.memorychat.agent.retrieval.RetrievalResult;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.model.PrivacyMode;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Runs one conversation turn through the stage pipeline.
 *
 * Per-turn flow:
 * 1. Privacy check (always first; fixes the effective mode)
 * 2. Stage plan for the effective mode and task type
 * 3. Retrieval, generation, extraction, analysis, in that order, as planned
 * 4. Aggregate into an {@link OrchestrationResult}
 *
 * Only a generation failure fails the turn. Every other stage failure becomes a
 * warning. Skippable stages are dropped once the token budget is exhausted.
 * The coordinator holds no per-turn state; concurrent turns share nothing but
 * the stage beans.
 */
@Service
@Slf4j
public class Coordinator {

    static final String GUARDIAN_FALLBACK_WARNING =
            "Privacy check failed; this turn runs in incognito mode";

    private final PrivacyGuardianAgent privacyGuardian;
    private final MemoryRetrievalAgent memoryRetrieval;
    private final ConversationGeneratorAgent conversationGenerator;
    private final MemoryManagerAgent memoryManager;
    private final ConversationAnalystAgent conversationAnalyst;
    private final OrchestratorProperties.Budget budgetConfig;

    public Coordinator(PrivacyGuardianAgent privacyGuardian,
                       MemoryRetrievalAgent memoryRetrieval,
                       ConversationGeneratorAgent conversationGenerator,
                       MemoryManagerAgent memoryManager,
                       ConversationAnalystAgent conversationAnalyst,
                       OrchestratorProperties properties) {
        this.privacyGuardian = privacyGuardian;
        this.memoryRetrieval = memoryRetrieval;
        this.conversationGenerator = conversationGenerator;
        this.memoryManager = memoryManager;
        this.conversationAnalyst = conversationAnalyst;
        this.budgetConfig = properties.getBudget();
    }

    public OrchestrationResult run(AgentInput input) {
        return run(input, () -> false);
    }

    public OrchestrationResult run(AgentInput input, BooleanSupplier cancelled) {
        return execute(input, cancelled, null);
    }

    /**
     * Same pipeline as {@link #run}, but reply text is pushed to {@code events}
     * as it arrives. Emits one METADATA event before generation, CONTENT events
     * for each delta, then exactly one COMPLETE or ERROR event. The returned
     * result is the same one carried by the terminal event.
     */
    public OrchestrationResult stream(AgentInput input, BooleanSupplier cancelled, Consumer<TurnEvent> events) {
        return execute(input, cancelled, events);
    }

    private OrchestrationResult execute(AgentInput request, BooleanSupplier cancelled, Consumer<TurnEvent> events) {
        MDC.put("sessionId", request.getSessionId());
        try {
            TurnContext turn = new TurnContext(request, TokenBudget.from(budgetConfig));
            log.info("Turn started [sessionId={}, mode={}, task={}, history={}]",
                    request.getSessionId(), request.getPrivacyMode().getValue(), request.getTaskType(),
                    request.getHistory().size());

            OrchestrationResult result = runPipeline(turn, cancelled, events);

            if (result.isSuccess()) {
                log.info("Turn complete [sessionId={}, agents={}, tokens={}, memoriesUsed={}, memoriesExtracted={}, latency={}ms]",
                        result.getSessionId(), result.getAgentsExecuted(), result.getTotalTokens(),
                        result.getMemoriesUsed(), result.getMemoriesExtracted(), result.getExecutionTimeMs());
            } else {
                log.warn("Turn failed [sessionId={}, kind={}, latency={}ms]: {}",
                        result.getSessionId(), result.getError().kind(), result.getExecutionTimeMs(),
                        result.getError().message());
            }
            if (events != null) {
                events.accept(result.isSuccess() ? TurnEvent.complete(result) : TurnEvent.error(result));
            }
            return result;
        } finally {
            MDC.remove("sessionId");
        }
    }

    private OrchestrationResult runPipeline(TurnContext turn, BooleanSupplier cancelled, Consumer<TurnEvent> events) {
        AgentInput input = turn.getInput();
        if (input.getMessage() == null || input.getMessage().isBlank()) {
            return turn.failure(new AgentError("Message must not be empty", ErrorKind.VALIDATION_ERROR));
        }
        if (input.getHistory().stream().anyMatch(m -> m == null || m.getRole() == null)) {
            return turn.failure(new AgentError("Every history message must have a role", ErrorKind.VALIDATION_ERROR));
        }

        OrchestrationResult blocked = runPrivacyCheck(turn);
        if (blocked != null) {
            return blocked;
        }

        List<AgentName> remaining = StagePlan.afterPrivacyCheck(turn.mode(), input.getTaskType());
        for (int i = 0; i < remaining.size(); i++) {
            AgentName stage = remaining.get(i);

            if (cancelled.getAsBoolean()) {
                log.info("Turn cancelled before {} [sessionId={}]", stage, input.getSessionId());
                if (turn.getReply() == null) {
                    return turn.failure(new AgentError("Turn cancelled before a reply was generated",
                            ErrorKind.UNHANDLED_ERROR));
                }
                turn.warn("Turn cancelled; skipped " + remaining.subList(i, remaining.size()));
                break;
            }
            if (stage.isSkippable() && turn.getBudget().isExhausted()) {
                turn.warn("Token budget exhausted; skipped " + stage);
                continue;
            }

            turn.moveTo(TurnState.of(stage));
            switch (stage) {
                case MEMORY_RETRIEVAL -> runRetrieval(turn);
                case CONVERSATION_GENERATOR -> {
                    AgentError error = runGeneration(turn, events);
                    if (error != null) {
                        return turn.failure(error);
                    }
                }
                case MEMORY_MANAGER -> runExtraction(turn);
                case CONVERSATION_ANALYST -> runAnalysis(turn);
                case PRIVACY_GUARDIAN -> throw new IllegalStateException("Privacy check planned twice");
            }
        }
        return turn.success();
    }

    /** Returns a terminal result when the message is blocked, otherwise null. */
    private OrchestrationResult runPrivacyCheck(TurnContext turn) {
        turn.moveTo(TurnState.PRIVACY_CHECK);
        AgentOutput<PrivacyVerdict> output = privacyGuardian.execute(turn.getInput());
        turn.record(AgentName.PRIVACY_GUARDIAN, output);

        if (!output.isSuccess()) {
            log.warn("Privacy check failed, falling back to incognito [sessionId={}]: {}",
                    turn.getInput().getSessionId(), output.getError().message());
            turn.warn(GUARDIAN_FALLBACK_WARNING);
            turn.setInput(turn.getInput().withPrivacyMode(PrivacyMode.INCOGNITO));
            return null;
        }

        PrivacyVerdict verdict = output.getData();
        turn.warnAll(verdict.warnings());
        turn.setInput(turn.getInput()
                .withPrivacyMode(verdict.sanitizedMode())
                .withMessage(verdict.sanitizedMessage()));

        if (!verdict.allowed()) {
            return turn.failure(new AgentError("Message blocked by privacy policy", ErrorKind.VALIDATION_ERROR));
        }
        return null;
    }

    private void runRetrieval(TurnContext turn) {
        AgentOutput<RetrievalResult> output = memoryRetrieval.execute(turn.getInput());
        turn.record(AgentName.MEMORY_RETRIEVAL, output);
        if (!output.isSuccess()) {
            turn.warn(AgentName.MEMORY_RETRIEVAL + " failed: " + output.getError().message());
            return;
        }
        RetrievalResult retrieval = output.getData();
        turn.setMemoriesUsed(retrieval.count());
        turn.warnAll(retrieval.warnings());
        turn.setInput(turn.getInput().withMemoryContext(retrieval.context()));
    }

    private AgentError runGeneration(TurnContext turn, Consumer<TurnEvent> events) {
        AgentOutput<GenerationResult> output;
        if (events != null) {
            events.accept(TurnEvent.metadata(metadata(turn)));
            output = conversationGenerator.executeStreaming(turn.getInput(),
                    delta -> events.accept(TurnEvent.content(delta)));
        } else {
            output = conversationGenerator.execute(turn.getInput());
        }
        turn.record(AgentName.CONVERSATION_GENERATOR, output);

        if (!output.isSuccess()) {
            return output.getError();
        }
        String reply = output.getData().reply();
        turn.setReply(reply);
        turn.setInput(turn.getInput().withAssistantReply(reply));
        return null;
    }

    private void runExtraction(TurnContext turn) {
        AgentOutput<ExtractionResult> output = memoryManager.execute(turn.getInput());
        turn.record(AgentName.MEMORY_MANAGER, output);
        if (!output.isSuccess()) {
            turn.warn(AgentName.MEMORY_MANAGER + " failed: " + output.getError().message());
            return;
        }
        turn.setMemoriesExtracted(output.getData().count());
        turn.warnAll(output.getData().warnings());
    }

    private void runAnalysis(TurnContext turn) {
        AgentOutput<AnalysisReport> output = conversationAnalyst.execute(turn.getInput());
        turn.record(AgentName.CONVERSATION_ANALYST, output);
        if (!output.isSuccess()) {
            turn.warn(AgentName.CONVERSATION_ANALYST + " failed: " + output.getError().message());
            return;
        }
        turn.setAnalysis(output.getData());
    }

    private Map<String, Object> metadata(TurnContext turn) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("session_id", String.valueOf(turn.getInput().getSessionId()));
        metadata.put("memories_used", turn.getMemoriesUsed());
        metadata.put("privacy_mode", turn.mode().getValue());
        metadata.put("warnings", List.copyOf(turn.getWarnings()));
        return metadata;
    }
}
