package com.deepansh.memorychat.core;

import com.deepansh.memorychat.agent.AgentName;

/**
 * Coordinator states, declared in the only order they may be entered.
 * Any state may move to ERROR; otherwise a turn only moves forward.
 */
public enum TurnState {
    INIT,
    PRIVACY_CHECK,
    RETRIEVAL,
    GENERATION,
    EXTRACTION,
    ANALYSIS,
    AGGREGATE,
    DONE,
    ERROR;

    public boolean canMoveTo(TurnState next) {
        if (this == DONE || this == ERROR) {
            return false;
        }
        return next == ERROR || next.ordinal() > ordinal();
    }

    public static TurnState of(AgentName stage) {
        return switch (stage) {
            case PRIVACY_GUARDIAN -> PRIVACY_CHECK;
            case MEMORY_RETRIEVAL -> RETRIEVAL;
            case CONVERSATION_GENERATOR -> GENERATION;
            case MEMORY_MANAGER -> EXTRACTION;
            case CONVERSATION_ANALYST -> ANALYSIS;
        };
    }
}
