package com.deepansh.memorychat.agent.analysis;

import java.util.List;
import java.util.Map;

/**
 * Conversation insights for the UI. Never needed to produce a reply.
 */
public record AnalysisReport(boolean skipped,
                             String skipReason,
                             Sentiment sentiment,
                             List<Topic> topics,
                             Patterns patterns,
                             Engagement engagement,
                             List<MemoryGap> memoryGaps,
                             Insights insights,
                             List<Recommendation> recommendations) {

    public static AnalysisReport skipped(String reason) {
        return new AnalysisReport(true, reason, null, List.of(), null, null, List.of(), null, List.of());
    }

    /** positive | negative | mixed | neutral */
    public record Sentiment(String label, double confidence, int positiveIndicators, int negativeIndicators) {
    }

    public record Topic(String topic, double relevance, int frequency) {
    }

    /** frequent_questions | recurring_topics | high_engagement */
    public record Patterns(List<String> patterns, Map<String, Integer> frequencies) {
    }

    /** level: high | medium | low */
    public record Engagement(double score, String level, int userMessages, double avgMessageLength,
                             int indicators, int questions) {
    }

    public record MemoryGap(String topic, String suggestion) {
    }

    public record Insights(String sessionSummary,
                           Map<String, Double> topicDistribution,
                           double memoryCoverage,
                           double profileFitScore,
                           List<String> patternSummary) {
    }

    /** type: memory_organization | engagement | sentiment | pattern | follow_up */
    public record Recommendation(String type, String priority, String message, String action) {
    }
}
