package com.deepansh.memorychat.exception;

import com.deepansh.memorychat.agent.ErrorKind;

/**
 * Failure reported by the LLM provider. The concrete subtype decides whether
 * the call is worth retrying.
 */
public abstract class ProviderException extends AgentException {

    protected ProviderException(String message) {
        super(message);
    }

    protected ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
