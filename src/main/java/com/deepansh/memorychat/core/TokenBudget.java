package com.deepansh.memorychat.core;

import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.config.OrchestratorProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-turn token accounting. Created fresh for every turn.
 *
 * Overruns are recorded and reported as warnings, never clipped: a completion
 * that already exists cannot be partially discarded. The coordinator consults
 * {@link #isExhausted()} only before skippable stages.
 */
public class TokenBudget {

    private final int totalBudget;
    private final double warningThreshold;
    private final Map<AgentName, Integer> perAgentBudget;
    private final Map<AgentName, Integer> consumedByAgent = new EnumMap<>(AgentName.class);

    private boolean thresholdWarned;
    private boolean overrunWarned;

    public TokenBudget(int totalBudget, double warningThreshold, Map<AgentName, Integer> perAgentBudget) {
        this.totalBudget = totalBudget;
        this.warningThreshold = warningThreshold;
        this.perAgentBudget = perAgentBudget.isEmpty()
                ? new EnumMap<>(AgentName.class)
                : new EnumMap<>(perAgentBudget);
    }

    public static TokenBudget from(OrchestratorProperties.Budget config) {
        return new TokenBudget(config.getTotal(), config.getWarningThreshold(), config.perAgentLimits());
    }

    /**
     * Adds a stage's usage and returns any advisory warnings it triggered.
     */
    public List<String> record(AgentName agent, int tokens) {
        List<String> warnings = new ArrayList<>();
        int agentTotal = consumedByAgent.merge(agent, Math.max(0, tokens), Integer::sum);

        Integer agentLimit = perAgentBudget.get(agent);
        if (agentLimit != null && agentTotal > agentLimit) {
            warnings.add(agent + " used " + agentTotal + " tokens, over its " + agentLimit + "-token budget");
        }

        int total = totalConsumed();
        if (!overrunWarned && total > totalBudget) {
            overrunWarned = true;
            thresholdWarned = true;
            warnings.add("Turn token budget exceeded: " + total + " of " + totalBudget + " tokens used");
        } else if (!thresholdWarned && total >= totalBudget * warningThreshold) {
            thresholdWarned = true;
            warnings.add("Turn token usage at " + Math.round(100.0 * total / totalBudget) + "% of its budget");
        }
        return warnings;
    }

    public boolean isExhausted() {
        return totalConsumed() > totalBudget;
    }

    public int totalConsumed() {
        return consumedByAgent.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalBudget() {
        return totalBudget;
    }

    public Map<AgentName, Integer> consumedByAgent() {
        return Collections.unmodifiableMap(consumedByAgent);
    }
}
