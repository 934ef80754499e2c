package com.deepansh.memorychat.core;

import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.model.PrivacyMode;
import com.deepansh.memorychat.model.TaskType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.deepansh.memorychat.agent.AgentName.CONVERSATION_ANALYST;
import static com.deepansh.memorychat.agent.AgentName.CONVERSATION_GENERATOR;
import static com.deepansh.memorychat.agent.AgentName.MEMORY_MANAGER;
import static com.deepansh.memorychat.agent.AgentName.MEMORY_RETRIEVAL;
import static com.deepansh.memorychat.agent.AgentName.PRIVACY_GUARDIAN;

/**
 * Fixed execution table: which stages a turn runs, in dependency order.
 * A pure function of (privacy mode, task type); history never changes the plan.
 */
public final class StagePlan {

    private static final Map<PrivacyMode, List<AgentName>> BASE_PLANS = new EnumMap<>(PrivacyMode.class);

    static {
        BASE_PLANS.put(PrivacyMode.NORMAL,
                List.of(PRIVACY_GUARDIAN, MEMORY_RETRIEVAL, CONVERSATION_GENERATOR, MEMORY_MANAGER));
        BASE_PLANS.put(PrivacyMode.PAUSE_MEMORIES,
                List.of(PRIVACY_GUARDIAN, MEMORY_RETRIEVAL, CONVERSATION_GENERATOR));
        BASE_PLANS.put(PrivacyMode.INCOGNITO,
                List.of(PRIVACY_GUARDIAN, CONVERSATION_GENERATOR));
    }

    private StagePlan() {
    }

    public static List<AgentName> forTurn(PrivacyMode mode, TaskType taskType) {
        List<AgentName> plan = new ArrayList<>(BASE_PLANS.get(mode));
        if (taskType == TaskType.CHAT_WITH_ANALYSIS) {
            plan.add(CONVERSATION_ANALYST);
        }
        return Collections.unmodifiableList(plan);
    }

    /** The stages of {@link #forTurn} that follow the privacy check. */
    public static List<AgentName> afterPrivacyCheck(PrivacyMode effectiveMode, TaskType taskType) {
        List<AgentName> plan = forTurn(effectiveMode, taskType);
        return plan.subList(1, plan.size());
    }
}
