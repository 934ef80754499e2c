package com.deepansh.memorychat.agent.conversation;

public record GenerationResult(String reply, String finishReason) {
}
