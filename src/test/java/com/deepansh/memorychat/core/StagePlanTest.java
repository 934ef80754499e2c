package com.deepansh.memorychat.core;

import com.deepansh.memorychat.model.PrivacyMode;
import com.deepansh.memorychat.model.TaskType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.deepansh.memorychat.agent.AgentName.CONVERSATION_ANALYST;
import static com.deepansh.memorychat.agent.AgentName.CONVERSATION_GENERATOR;
import static com.deepansh.memorychat.agent.AgentName.MEMORY_MANAGER;
import static com.deepansh.memorychat.agent.AgentName.MEMORY_RETRIEVAL;
import static com.deepansh.memorychat.agent.AgentName.PRIVACY_GUARDIAN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StagePlanTest {

    @Test
    void forTurn_normal_runsEveryChatStage() {
        assertThat(StagePlan.forTurn(PrivacyMode.NORMAL, TaskType.CHAT))
                .containsExactly(PRIVACY_GUARDIAN, MEMORY_RETRIEVAL, CONVERSATION_GENERATOR, MEMORY_MANAGER);
    }

    @Test
    void forTurn_incognito_onlyGuardianAndGenerator() {
        assertThat(StagePlan.forTurn(PrivacyMode.INCOGNITO, TaskType.CHAT))
                .containsExactly(PRIVACY_GUARDIAN, CONVERSATION_GENERATOR);
    }

    @Test
    void forTurn_pauseMemories_readsWithoutExtraction() {
        assertThat(StagePlan.forTurn(PrivacyMode.PAUSE_MEMORIES, TaskType.CHAT))
                .containsExactly(PRIVACY_GUARDIAN, MEMORY_RETRIEVAL, CONVERSATION_GENERATOR);
    }

    @ParameterizedTest
    @EnumSource(PrivacyMode.class)
    void forTurn_withAnalysis_appendsAnalystLast(PrivacyMode mode) {
        assertThat(StagePlan.forTurn(mode, TaskType.CHAT_WITH_ANALYSIS))
                .startsWith(PRIVACY_GUARDIAN)
                .endsWith(CONVERSATION_ANALYST)
                .contains(CONVERSATION_GENERATOR);
    }

    @ParameterizedTest
    @EnumSource(PrivacyMode.class)
    void forTurn_memoryStagesFollowModePermissions(PrivacyMode mode) {
        var plan = StagePlan.forTurn(mode, TaskType.CHAT);
        assertThat(plan.contains(MEMORY_RETRIEVAL)).isEqualTo(mode.allowsRetrieval());
        assertThat(plan.contains(MEMORY_MANAGER)).isEqualTo(mode.allowsStorage());
    }

    @Test
    void afterPrivacyCheck_dropsTheGuardian() {
        assertThat(StagePlan.afterPrivacyCheck(PrivacyMode.INCOGNITO, TaskType.CHAT))
                .containsExactly(CONVERSATION_GENERATOR);
    }

    @Test
    void forTurn_returnsUnmodifiablePlan() {
        var plan = StagePlan.forTurn(PrivacyMode.NORMAL, TaskType.CHAT);
        assertThatThrownBy(() -> plan.add(CONVERSATION_ANALYST))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
