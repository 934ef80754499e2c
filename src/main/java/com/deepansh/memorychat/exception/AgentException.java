package com.deepansh.memorychat.exception;

/**
 * Base unchecked exception for failures raised inside the orchestrator and its collaborators.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
