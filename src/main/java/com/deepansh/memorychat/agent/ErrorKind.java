package com.deepansh.memorychat.agent;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorKind {

    /** Bad input shape, rejected before any stage runs. */
    VALIDATION_ERROR("ValidationError"),
    /** Timeout, connection or rate limit. Retried with bounded backoff. */
    PROVIDER_TRANSIENT_ERROR("ProviderTransientError"),
    /** Auth or bad request. Never retried. */
    PROVIDER_FATAL_ERROR("ProviderFatalError"),
    /** Memory read/write failure. Always absorbed. */
    STORE_ERROR("StoreError"),
    /** Anything caught by the agent boundary. */
    UNHANDLED_ERROR("UnhandledError");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isProviderError() {
        return this == PROVIDER_TRANSIENT_ERROR || this == PROVIDER_FATAL_ERROR;
    }
}
