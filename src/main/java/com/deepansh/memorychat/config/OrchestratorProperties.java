package com.deepansh.memorychat.config;

import com.deepansh.memorychat.agent.AgentName;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tuning for the turn pipeline, bound from {@code memorychat.orchestrator.*}.
 *
 * Example application.yml:
 *
 * memorychat:
 *   orchestrator:
 *     budget:
 *       total: 5000
 *       per-agent:
 *         ConversationGenerator: 2000
 *     analysis:
 *       interval: 5
 */
@Data
@ConfigurationProperties(prefix = "memorychat.orchestrator")
public class OrchestratorProperties {

    private Budget budget = new Budget();
    private Retrieval retrieval = new Retrieval();
    private Generation generation = new Generation();
    private Extraction extraction = new Extraction();
    private Analysis analysis = new Analysis();
    private Privacy privacy = new Privacy();

    @Data
    public static class Budget {
        private int total = 5000;
        /** Fraction of the total at which an advisory warning is added. */
        private double warningThreshold = 0.8;
        /** Keyed by stage display name, e.g. "MemoryRetrieval". */
        private Map<String, Integer> perAgent = new LinkedHashMap<>(Map.of(
                "PrivacyGuardian", 500,
                "MemoryRetrieval", 800,
                "ConversationGenerator", 2000,
                "MemoryManager", 1000,
                "ConversationAnalyst", 600));

        public Map<AgentName, Integer> perAgentLimits() {
            Map<AgentName, Integer> limits = new EnumMap<>(AgentName.class);
            perAgent.forEach((name, limit) -> limits.put(AgentName.fromDisplayName(name), limit));
            return limits;
        }
    }

    @Data
    public static class Retrieval {
        private int topK = 5;
    }

    @Data
    public static class Generation {
        private double temperature = 0.7;
        private int maxTokens = 500;
        private int maxHistoryMessages = 20;
        private int maxMemoryContextChars = 2000;
    }

    @Data
    public static class Extraction {
        private double temperature = 0.3;
        private int maxTokens = 300;
    }

    @Data
    public static class Analysis {
        /** Every Nth turn of a session includes analysis. 0 disables the schedule. */
        private int interval = 5;
        private int minMessages = 2;
    }

    @Data
    public static class Privacy {
        /** When true, high-severity findings end the turn before generation. */
        private boolean blockHighSeverity = false;
    }
}
