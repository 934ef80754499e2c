package com.deepansh.memorychat.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One chat session.
 *
 * Collection: chat_sessions
 *
 * The session is bound to the profile it was opened with; a later turn asking
 * for another profile is downgraded to incognito by the privacy check.
 * turnCount drives the periodic analysis schedule.
 */
@Document(collection = "chat_sessions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMetadata {

    @Id
    private String sessionId;

    @Indexed
    private String userId;

    /** Null for the user's default profile. */
    private String profileId;

    @Builder.Default
    private int turnCount = 0;

    private Instant createdAt;

    @Indexed
    private Instant updatedAt;
}
