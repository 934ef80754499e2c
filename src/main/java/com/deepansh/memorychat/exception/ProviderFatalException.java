package com.deepansh.memorychat.exception;

import com.deepansh.memorychat.agent.ErrorKind;

/** Auth failure, bad request or an unusable payload. Never retried. */
public class ProviderFatalException extends ProviderException {

    public ProviderFatalException(String message) {
        super(message);
    }

    public ProviderFatalException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER_FATAL_ERROR;
    }
}
