package com.deepansh.memorychat.core;

import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.exception.MemoryStoreException;
import com.deepansh.memorychat.memory.SessionHistoryStore;
import com.deepansh.memorychat.memory.SessionMetadata;
import com.deepansh.memorychat.memory.SessionService;
import com.deepansh.memorychat.model.ChatRequest;
import com.deepansh.memorychat.model.Message;
import com.deepansh.memorychat.model.PrivacyMode;
import com.deepansh.memorychat.model.TaskType;
import com.deepansh.memorychat.observability.TurnTraceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Wraps the coordinator with session bookkeeping.
 *
 * Per-turn flow:
 * 1. Resolve the session id and record the turn (MongoDB)
 * 2. Decide whether this turn includes analysis
 * 3. Load the history window (Redis) unless the request carries one
 * 4. Run the coordinator
 * 5. Append the exchange to the history window (skipped in incognito)
 * 6. Async: persist the turn trace
 */
@Service
@Slf4j
public class ChatTurnService {

    private final Coordinator coordinator;
    private final SessionService sessionService;
    private final SessionHistoryStore historyStore;
    private final TurnTraceService traceService;
    private final OrchestratorProperties.Analysis analysisConfig;

    public ChatTurnService(Coordinator coordinator,
                           SessionService sessionService,
                           SessionHistoryStore historyStore,
                           TurnTraceService traceService,
                           OrchestratorProperties properties) {
        this.coordinator = coordinator;
        this.sessionService = sessionService;
        this.historyStore = historyStore;
        this.traceService = traceService;
        this.analysisConfig = properties.getAnalysis();
    }

    public OrchestrationResult handle(ChatRequest request) {
        AgentInput input = prepare(request);
        OrchestrationResult result = coordinator.run(input);
        complete(request, input, result);
        return result;
    }

    public OrchestrationResult stream(ChatRequest request, BooleanSupplier cancelled, Consumer<TurnEvent> events) {
        AgentInput input = prepare(request);
        OrchestrationResult result = coordinator.stream(input, cancelled, events);
        complete(request, input, result);
        return result;
    }

    AgentInput prepare(ChatRequest request) {
        String sessionId = resolveSessionId(request.getSessionId());
        String userId = request.getUserId() != null && !request.getUserId().isBlank()
                ? request.getUserId() : "default";
        PrivacyMode mode = request.getPrivacyMode() != null ? request.getPrivacyMode() : PrivacyMode.NORMAL;

        String sessionProfileId = null;
        int turnCount = 0;
        try {
            SessionMetadata session = sessionService.recordTurn(sessionId, userId, request.getProfileId());
            sessionProfileId = session.getProfileId();
            turnCount = session.getTurnCount();
        } catch (MemoryStoreException e) {
            log.warn("Session bookkeeping unavailable [sessionId={}]: {}", sessionId, e.getMessage());
        }

        List<Message> history = request.getHistory() != null
                ? request.getHistory()
                : historyStore.load(sessionId);

        TaskType taskType = analysisDue(request.isAnalyze(), turnCount)
                ? TaskType.CHAT_WITH_ANALYSIS
                : TaskType.CHAT;

        return AgentInput.builder()
                .sessionId(sessionId)
                .userId(userId)
                .message(request.getMessage())
                .privacyMode(mode)
                .profileId(request.getProfileId())
                .sessionProfileId(sessionProfileId)
                .taskType(taskType)
                .history(Collections.unmodifiableList(new ArrayList<>(history)))
                .build();
    }

    boolean analysisDue(boolean requested, int turnCount) {
        if (requested) {
            return true;
        }
        int interval = analysisConfig.getInterval();
        return interval > 0 && turnCount > 0 && turnCount % interval == 0;
    }

    private void complete(ChatRequest request, AgentInput input, OrchestrationResult result) {
        if (result.isSuccess() && result.getPrivacyMode() != PrivacyMode.INCOGNITO) {
            historyStore.append(input.getSessionId(), request.getMessage(), result.getReply());
        }
        traceService.persistTrace(input.getUserId(), input.getProfileId(), request.getMessage(), result);
    }

    private String resolveSessionId(String provided) {
        return (provided != null && !provided.isBlank()) ? provided : UUID.randomUUID().toString();
    }
}
