package com.deepansh.memorychat.exception;

import com.deepansh.memorychat.agent.ErrorKind;

/** Timeout, connection failure, rate limit or 5xx. Retryable. */
public class ProviderTransientException extends ProviderException {

    public ProviderTransientException(String message) {
        super(message);
    }

    public ProviderTransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER_TRANSIENT_ERROR;
    }
}
