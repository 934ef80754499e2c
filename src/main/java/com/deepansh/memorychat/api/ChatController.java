package com.deepansh.memorychat.api;

import com.deepansh.memorychat.agent.ErrorKind;
import com.deepansh.memorychat.core.ChatTurnService;
import com.deepansh.memorychat.core.OrchestrationResult;
import com.deepansh.memorychat.core.TurnEvent;
import com.deepansh.memorychat.model.ChatRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Chat endpoints.
 *
 * POST /api/v1/chat/turn    one turn, full result as JSON
 *   200 on success, 400 for validation errors, 502 when the provider failed
 *
 * POST /api/v1/chat/stream  same turn as server-sent events:
 *   metadata, content..., then complete or error.
 *   A client disconnect cancels the stages that have not started yet.
 *
 * GET /api/v1/chat/health
 */
@RestController
@RequestMapping("/api/v1/chat")
@Slf4j
public class ChatController {

    private final ChatTurnService chatTurnService;
    private final Executor streamExecutor;
    private final long streamTimeoutMs;

    public ChatController(ChatTurnService chatTurnService,
                          @Qualifier("streamTaskExecutor") Executor streamExecutor,
                          @Value("${memorychat.stream.timeout-ms:120000}") long streamTimeoutMs) {
        this.chatTurnService = chatTurnService;
        this.streamExecutor = streamExecutor;
        this.streamTimeoutMs = streamTimeoutMs;
    }

    @PostMapping("/turn")
    public ResponseEntity<OrchestrationResult> turn(@Valid @RequestBody ChatRequest request) {
        log.info("Chat turn request [sessionId={}, userId={}, profileId={}, mode={}]",
                request.getSessionId(), request.getUserId(), request.getProfileId(), request.getPrivacyMode());

        OrchestrationResult result = chatTurnService.handle(request);
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody ChatRequest request) {
        log.info("Chat stream request [sessionId={}, userId={}, profileId={}, mode={}]",
                request.getSessionId(), request.getUserId(), request.getProfileId(), request.getPrivacyMode());

        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        emitter.onCompletion(() -> cancelled.set(true));
        emitter.onTimeout(() -> cancelled.set(true));
        emitter.onError(e -> cancelled.set(true));

        streamExecutor.execute(() -> {
            try {
                chatTurnService.stream(request, cancelled::get, event -> send(emitter, event, cancelled));
                emitter.complete();
            } catch (Exception e) {
                log.error("Streamed turn failed [sessionId={}]", request.getSessionId(), e);
                emitter.completeWithError(e);
            }
        });
        return emitter;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    static HttpStatus statusFor(OrchestrationResult result) {
        if (result.isSuccess()) {
            return HttpStatus.OK;
        }
        ErrorKind kind = result.getError() != null ? result.getError().kind() : ErrorKind.UNHANDLED_ERROR;
        return switch (kind) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case PROVIDER_TRANSIENT_ERROR, PROVIDER_FATAL_ERROR -> HttpStatus.BAD_GATEWAY;
            case STORE_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case UNHANDLED_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private void send(SseEmitter emitter, TurnEvent event, AtomicBoolean cancelled) {
        if (cancelled.get()) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().name(event.type().value()).data(event, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.info("Stream client went away, cancelling remaining stages: {}", e.getMessage());
            cancelled.set(true);
        }
    }
}
