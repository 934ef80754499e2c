package com.deepansh.memorychat.core;

import com.deepansh.memorychat.agent.AgentError;
import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.agent.analysis.AnalysisReport;
import com.deepansh.memorychat.model.PrivacyMode;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable per-turn state. Created at the start of each coordinator run,
 * populated stage by stage, then frozen into an {@link OrchestrationResult}.
 * Never shared between turns.
 */
@Slf4j
@Getter
class TurnContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final TokenBudget budget;
    private final List<AgentName> agentsExecuted = new ArrayList<>();
    private final Map<String, Integer> tokensByAgent = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    private TurnState state = TurnState.INIT;

    @Setter
    private AgentInput input;
    @Setter
    private String reply;
    @Setter
    private int memoriesUsed;
    @Setter
    private int memoriesExtracted;
    @Setter
    private AnalysisReport analysis;

    TurnContext(AgentInput input, TokenBudget budget) {
        this.input = input;
        this.budget = budget;
    }

    void moveTo(TurnState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal turn transition " + state + " -> " + next);
        }
        log.debug("Turn state {} -> {} [sessionId={}]", state, next, input.getSessionId());
        state = next;
    }

    void record(AgentName stage, AgentOutput<?> output) {
        agentsExecuted.add(stage);
        tokensByAgent.merge(stage.getDisplayName(), output.getTokensUsed(), Integer::sum);
        warnings.addAll(budget.record(stage, output.getTokensUsed()));
        log.info("Stage finished [sessionId={}, stage={}, success={}, tokens={}, latency={}ms]",
                input.getSessionId(), stage, output.isSuccess(), output.getTokensUsed(),
                output.getExecutionTimeMs());
    }

    void warn(String warning) {
        warnings.add(warning);
    }

    void warnAll(List<String> more) {
        warnings.addAll(more);
    }

    PrivacyMode mode() {
        return input.getPrivacyMode();
    }

    long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    OrchestrationResult success() {
        moveTo(TurnState.AGGREGATE);
        OrchestrationResult result = baseResult()
                .success(true)
                .reply(reply)
                .analysis(analysis)
                .build();
        moveTo(TurnState.DONE);
        return result;
    }

    OrchestrationResult failure(AgentError error) {
        moveTo(TurnState.ERROR);
        return baseResult()
                .success(false)
                .error(error)
                .build();
    }

    private OrchestrationResult.OrchestrationResultBuilder baseResult() {
        return OrchestrationResult.builder()
                .sessionId(input.getSessionId())
                .memoriesUsed(memoriesUsed)
                .memoriesExtracted(memoriesExtracted)
                .agentsExecuted(List.copyOf(agentsExecuted))
                .tokensByAgent(new LinkedHashMap<>(tokensByAgent))
                .totalTokens(budget.totalConsumed())
                .warnings(List.copyOf(warnings))
                .privacyMode(input.getPrivacyMode())
                .executionTimeMs(elapsedMs());
    }
}
