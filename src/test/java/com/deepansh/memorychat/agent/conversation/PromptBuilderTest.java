package com.deepansh.memorychat.agent.conversation;

import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private PromptBuilder builder;

    @BeforeEach
    void setUp() {
        OrchestratorProperties props = new OrchestratorProperties();
        props.getGeneration().setMaxHistoryMessages(4);
        props.getGeneration().setMaxMemoryContextChars(20);
        builder = new PromptBuilder(props);
    }

    @Test
    void build_withoutMemories_usesPlainSystemPrompt() {
        List<Message> messages = builder.build(input("hello", List.of(), ""));

        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(messages.get(0).getContent()).isEqualTo(PromptBuilder.SYSTEM_PROMPT);
        assertThat(messages.get(1)).isEqualTo(Message.user("hello"));
    }

    @Test
    void build_withMemories_appendsMemoryBlock() {
        List<Message> messages = builder.build(input("hello", List.of(), "1. Is vegetarian"));

        assertThat(messages.get(0).getContent())
                .isEqualTo(PromptBuilder.SYSTEM_PROMPT + PromptBuilder.MEMORY_HEADER + "1. Is vegetarian");
    }

    @Test
    void build_longMemoryContext_isTruncated() {
        String context = "1. " + "x".repeat(50);

        String system = builder.build(input("hello", List.of(), context)).get(0).getContent();

        assertThat(system).endsWith(PromptBuilder.MEMORY_HEADER + context.substring(0, 20) + "...");
    }

    @Test
    void build_longMemoryContext_isCutAtLastLineBreakThatFits() {
        String context = "1. Is vegetarian\n2. Loves spicy Thai food";

        String system = builder.build(input("hello", List.of(), context)).get(0).getContent();

        assertThat(system).endsWith(PromptBuilder.MEMORY_HEADER + "1. Is vegetarian...");
    }

    @Test
    void truncate_neverSplitsSurrogatePair() {
        String context = "1. " + "x".repeat(16) + "\uD83C\uDF5C" + " ramen";

        String truncated = builder.truncate(context);

        assertThat(truncated).isEqualTo("1. " + "x".repeat(16) + "...");
        assertThat(Character.isHighSurrogate(truncated.charAt(truncated.length() - 4))).isFalse();
    }

    @Test
    void build_keepsOnlyRecentHistoryAndDropsSystemMessages() {
        List<Message> history = new ArrayList<>();
        history.add(Message.system("old system prompt"));
        for (int i = 1; i <= 6; i++) {
            history.add(i % 2 == 1 ? Message.user("u" + i) : Message.assistant("a" + i));
        }

        List<Message> messages = builder.build(input("now", history, ""));

        assertThat(messages).extracting(Message::getContent)
                .containsExactly(PromptBuilder.SYSTEM_PROMPT, "u3", "a4", "u5", "a6", "now");
    }

    private static AgentInput input(String message, List<Message> history, String memoryContext) {
        return AgentInput.builder()
                .sessionId("s")
                .message(message)
                .history(history)
                .memoryContext(memoryContext)
                .build();
    }
}
