package com.deepansh.memorychat.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class ChatRequest {

    @NotBlank(message = "message must not be blank")
    @Size(max = 10000, message = "message must be at most 10000 characters")
    private String message;

    /**
     * Optional. If null a new session is started.
     */
    private String sessionId;

    /**
     * Optional. Defaults to "default".
     */
    private String userId;

    /** Memory profile scoping retrieval and storage. Null means the user's default profile. */
    private String profileId;

    private PrivacyMode privacyMode = PrivacyMode.NORMAL;

    /** Forces a conversation analysis on this turn regardless of the periodic schedule. */
    private boolean analyze;

    /**
     * Optional explicit history. When absent the session's stored window is used.
     */
    private List<@NotNull @Valid Message> history;
}
