package com.deepansh.memorychat.api;

import com.deepansh.memorychat.memory.SessionHistoryStore;
import com.deepansh.memorychat.memory.SessionMetadata;
import com.deepansh.memorychat.memory.SessionService;
import com.deepansh.memorychat.model.Message;
import com.deepansh.memorychat.observability.TurnTrace;
import com.deepansh.memorychat.observability.TurnTraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Session inspection.
 *
 * GET    /api/v1/sessions?userId=...            sessions of a user, most recent first
 * GET    /api/v1/sessions/{sessionId}/history   stored history window
 * DELETE /api/v1/sessions/{sessionId}/history   clears the history window
 * GET    /api/v1/sessions/{sessionId}/traces    turn traces, most recent first
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;
    private final SessionHistoryStore historyStore;
    private final TurnTraceService traceService;

    @GetMapping
    public ResponseEntity<List<SessionMetadata>> sessions(@RequestParam(defaultValue = "default") String userId) {
        return ResponseEntity.ok(sessionService.getSessionsForUser(userId));
    }

    @GetMapping("/{sessionId}/history")
    public ResponseEntity<List<Message>> history(@PathVariable String sessionId) {
        return ResponseEntity.ok(historyStore.load(sessionId));
    }

    @DeleteMapping("/{sessionId}/history")
    public ResponseEntity<Void> clearHistory(@PathVariable String sessionId) {
        historyStore.clear(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/traces")
    public ResponseEntity<List<TurnTrace>> traces(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.getTracesForSession(sessionId));
    }
}
