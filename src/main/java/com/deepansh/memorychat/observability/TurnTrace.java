package com.deepansh.memorychat.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Trace of one coordinator turn.
 *
 * Collection: turn_traces
 *
 * Captures the stage sequence, per-stage token usage, warnings and the failure
 * kind, if any. Message and reply are truncated; incognito turns store neither.
 */
@Document(collection = "turn_traces")
@CompoundIndex(name = "idx_session_created", def = "{'sessionId': 1, 'createdAt': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnTrace {

    public enum Status { SUCCESS, ERROR }

    @Id
    private String id;

    private String sessionId;

    @Indexed
    private String userId;

    private String profileId;

    private String privacyMode;

    private Status status;

    private String errorKind;

    private String errorMessage;

    private String userMessage;

    private String reply;

    private List<String> agentsExecuted;

    private Map<String, Integer> tokensByAgent;

    private int totalTokens;

    private int memoriesUsed;

    private int memoriesExtracted;

    private List<String> warnings;

    private long latencyMs;

    @CreatedDate
    private Instant createdAt;
}
