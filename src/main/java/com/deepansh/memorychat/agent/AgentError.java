package com.deepansh.memorychat.agent;

public record AgentError(String message, ErrorKind kind) {
}
