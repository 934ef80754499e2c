package com.deepansh.memorychat.agent.conversation;

import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the provider message list for a turn:
 * one system instruction (with the memory block when present), the most recent
 * history window, then the new user message.
 */
@Component
public class PromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are a helpful AI assistant with a good memory. You engage in natural, \
            conversational interactions with users. Your responses should be:
            - Contextually relevant and helpful
            - Natural and conversational in tone
            - Informed by the user's memory context when available
            - Respectful of privacy settings

            When you have access to memory context, use it to provide personalized responses. \
            When you don't have memory context, respond naturally without referencing memories.""";

    static final String MEMORY_HEADER = "\n\nUser's Memory Context:\n";

    private final int maxHistoryMessages;
    private final int maxMemoryContextChars;

    public PromptBuilder(OrchestratorProperties properties) {
        this.maxHistoryMessages = properties.getGeneration().getMaxHistoryMessages();
        this.maxMemoryContextChars = properties.getGeneration().getMaxMemoryContextChars();
    }

    public List<Message> build(AgentInput input) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(systemInstruction(input.getMemoryContext())));

        List<Message> history = input.getHistory().stream()
                .filter(m -> m.getRole() != Message.Role.system)
                .filter(m -> m.getContent() != null && !m.getContent().isBlank())
                .toList();
        int from = Math.max(0, history.size() - maxHistoryMessages);
        messages.addAll(history.subList(from, history.size()));

        messages.add(Message.user(input.getMessage()));
        return messages;
    }

    String systemInstruction(String memoryContext) {
        if (memoryContext == null || memoryContext.isBlank()) {
            return SYSTEM_PROMPT;
        }
        return SYSTEM_PROMPT + MEMORY_HEADER + truncate(memoryContext);
    }

    /**
     * Cuts the memory block to at most maxMemoryContextChars, on the last line
     * break that fits so no numbered memory is split. A block whose first line
     * alone is too long is cut at the limit, never inside a surrogate pair.
     */
    String truncate(String memoryContext) {
        if (memoryContext.length() <= maxMemoryContextChars) {
            return memoryContext;
        }
        int cut = memoryContext.lastIndexOf('\n', maxMemoryContextChars);
        if (cut <= 0) {
            cut = maxMemoryContextChars;
            if (cut > 0 && Character.isHighSurrogate(memoryContext.charAt(cut - 1))) {
                cut--;
            }
        }
        return memoryContext.substring(0, cut) + "...";
    }
}
