package com.deepansh.memorychat.exception;

public class MemoryStoreException extends AgentException {

    public MemoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
