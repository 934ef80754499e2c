package com.deepansh.memorychat.core;

import com.deepansh.memorychat.agent.AgentError;
import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.agent.analysis.AnalysisReport;
import com.deepansh.memorychat.model.PrivacyMode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one turn. Built fresh by the coordinator and never persisted as-is.
 *
 * When {@code success} is false there is no reply and {@code error} says why.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrchestrationResult {

    String sessionId;
    boolean success;
    String reply;
    int memoriesUsed;
    int memoriesExtracted;
    List<AgentName> agentsExecuted;
    /** Keyed by stage display name, in execution order. */
    Map<String, Integer> tokensByAgent;
    int totalTokens;
    List<String> warnings;
    /** The mode actually applied after the privacy check. */
    PrivacyMode privacyMode;
    AgentError error;
    AnalysisReport analysis;
    long executionTimeMs;
}
