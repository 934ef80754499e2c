package com.deepansh.memorychat.agent.retrieval;

public record RetrievedMemory(String id, String text) {
}
