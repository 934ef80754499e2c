package com.deepansh.memorychat.observability;

import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.core.OrchestrationResult;
import com.deepansh.memorychat.model.PrivacyMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Persists turn traces off the request thread.
 *
 * Called once per turn by ChatTurnService after the result is built. A failed
 * write is logged and dropped; it never reaches the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TurnTraceService {

    private static final int MAX_TEXT = 4000;

    private final TurnTraceRepository traceRepository;

    @Async("traceTaskExecutor")
    public void persistTrace(String userId, String profileId, String userMessage, OrchestrationResult result) {
        try {
            traceRepository.save(toTrace(userId, profileId, userMessage, result));
            log.info("Trace persisted [session={}, success={}, latency={}ms, tokens={}]",
                    result.getSessionId(), result.isSuccess(), result.getExecutionTimeMs(), result.getTotalTokens());
        } catch (Exception e) {
            log.error("Failed to persist turn trace for session={}", result.getSessionId(), e);
        }
    }

    public List<TurnTrace> getTracesForSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    TurnTrace toTrace(String userId, String profileId, String userMessage, OrchestrationResult result) {
        boolean incognito = result.getPrivacyMode() == PrivacyMode.INCOGNITO;
        return TurnTrace.builder()
                .sessionId(result.getSessionId())
                .userId(userId)
                .profileId(profileId)
                .privacyMode(result.getPrivacyMode() != null ? result.getPrivacyMode().getValue() : null)
                .status(result.isSuccess() ? TurnTrace.Status.SUCCESS : TurnTrace.Status.ERROR)
                .errorKind(result.getError() != null ? result.getError().kind().getValue() : null)
                .errorMessage(result.getError() != null ? result.getError().message() : null)
                .userMessage(incognito ? null : truncate(userMessage))
                .reply(incognito ? null : truncate(result.getReply()))
                .agentsExecuted(result.getAgentsExecuted().stream().map(AgentName::getDisplayName).toList())
                .tokensByAgent(result.getTokensByAgent())
                .totalTokens(result.getTotalTokens())
                .memoriesUsed(result.getMemoriesUsed())
                .memoriesExtracted(result.getMemoriesExtracted())
                .warnings(result.getWarnings())
                .latencyMs(result.getExecutionTimeMs())
                .build();
    }

    private String truncate(String s) {
        if (s == null) return null;
        return s.length() <= MAX_TEXT ? s : s.substring(0, MAX_TEXT) + "...[truncated]";
    }
}
