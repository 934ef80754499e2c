package com.deepansh.memorychat.core;

import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.config.OrchestratorProperties;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TokenBudgetTest {

    @Test
    void record_underThreshold_noWarnings() {
        TokenBudget budget = new TokenBudget(1000, 0.8, Map.of());

        assertThat(budget.record(AgentName.MEMORY_RETRIEVAL, 100)).isEmpty();
        assertThat(budget.isExhausted()).isFalse();
        assertThat(budget.totalConsumed()).isEqualTo(100);
    }

    @Test
    void record_crossingThreshold_warnsOnce() {
        TokenBudget budget = new TokenBudget(1000, 0.8, Map.of());

        assertThat(budget.record(AgentName.CONVERSATION_GENERATOR, 850))
                .containsExactly("Turn token usage at 85% of its budget");
        assertThat(budget.record(AgentName.MEMORY_MANAGER, 50)).isEmpty();
    }

    @Test
    void record_overrun_warnsAndMarksExhausted() {
        TokenBudget budget = new TokenBudget(100, 0.8, Map.of());

        assertThat(budget.record(AgentName.CONVERSATION_GENERATOR, 150))
                .containsExactly("Turn token budget exceeded: 150 of 100 tokens used");
        assertThat(budget.isExhausted()).isTrue();
        assertThat(budget.record(AgentName.MEMORY_MANAGER, 10)).isEmpty();
    }

    @Test
    void isExhausted_exactlyAtBudget_isNotExhausted() {
        TokenBudget budget = new TokenBudget(100, 0.8, Map.of());
        budget.record(AgentName.CONVERSATION_GENERATOR, 100);

        assertThat(budget.isExhausted()).isFalse();
    }

    @Test
    void record_perAgentOverrun_isFlaggedButNotClipped() {
        TokenBudget budget = new TokenBudget(5000, 0.8, Map.of(AgentName.CONVERSATION_GENERATOR, 200));

        assertThat(budget.record(AgentName.CONVERSATION_GENERATOR, 300))
                .containsExactly("ConversationGenerator used 300 tokens, over its 200-token budget");
        assertThat(budget.consumedByAgent()).containsEntry(AgentName.CONVERSATION_GENERATOR, 300);
    }

    @Test
    void record_negativeTokens_countAsZero() {
        TokenBudget budget = new TokenBudget(100, 0.8, Map.of());
        budget.record(AgentName.PRIVACY_GUARDIAN, -5);

        assertThat(budget.totalConsumed()).isZero();
    }

    @Test
    void from_bindsConfiguredLimits() {
        OrchestratorProperties.Budget config = new OrchestratorProperties.Budget();
        config.setTotal(300);

        TokenBudget budget = TokenBudget.from(config);

        assertThat(budget.totalBudget()).isEqualTo(300);
        assertThat(budget.record(AgentName.MEMORY_RETRIEVAL, 900))
                .contains("MemoryRetrieval used 900 tokens, over its 800-token budget");
    }
}
