package com.deepansh.memorychat.agent;

import com.deepansh.memorychat.model.Message;
import com.deepansh.memorychat.model.PrivacyMode;
import com.deepansh.memorychat.model.TaskType;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Immutable view of a turn handed to each stage.
 *
 * The coordinator never mutates an input; it derives the next stage's view with
 * the {@code with*} copies (sanitized message, effective mode, retrieved memory
 * context, generated reply), so every stage sees a reproducible snapshot.
 */
@Value
@With
@Builder(toBuilder = true)
public class AgentInput {

    String sessionId;

    @Builder.Default
    String userId = "default";

    String message;

    @Builder.Default
    PrivacyMode privacyMode = PrivacyMode.NORMAL;

    /** Nullable: null means the user's default profile. */
    String profileId;

    /** Profile the session was opened with, when the persistence layer knows it. */
    String sessionProfileId;

    @Builder.Default
    TaskType taskType = TaskType.CHAT;

    /** Prior turns, oldest first. */
    @Builder.Default
    List<Message> history = List.of();

    // ─── Stage-to-stage scratch fields ──────────────────────────────────────

    /** Prompt-ready memory block produced by retrieval. Empty when nothing was retrieved. */
    @Builder.Default
    String memoryContext = "";

    /** Reply produced by generation, consumed by extraction. */
    String assistantReply;
}
