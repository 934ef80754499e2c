package com.deepansh.memorychat.model;

/**
 * What the caller wants out of a turn. Analysis is never run implicitly by the
 * coordinator; the service layer opts in every N turns or on explicit request.
 */
public enum TaskType {
    CHAT,
    CHAT_WITH_ANALYSIS
}
