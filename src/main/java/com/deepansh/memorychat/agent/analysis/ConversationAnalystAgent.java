package com.deepansh.memorychat.agent.analysis;

import com.deepansh.memorychat.agent.AbstractAgent;
import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.agent.analysis.AnalysisReport.Engagement;
import com.deepansh.memorychat.agent.analysis.AnalysisReport.Insights;
import com.deepansh.memorychat.agent.analysis.AnalysisReport.MemoryGap;
import com.deepansh.memorychat.agent.analysis.AnalysisReport.Patterns;
import com.deepansh.memorychat.agent.analysis.AnalysisReport.Recommendation;
import com.deepansh.memorychat.agent.analysis.AnalysisReport.Sentiment;
import com.deepansh.memorychat.agent.analysis.AnalysisReport.Topic;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.model.Message;
import com.deepansh.memorychat.text.Keywords;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule-based conversation analysis: sentiment, topics, recurring patterns,
 * engagement, memory gaps and follow-up recommendations.
 *
 * Keyword driven, no provider call, so it reports zero tokens.
 */
@Component
@Slf4j
public class ConversationAnalystAgent extends AbstractAgent<AnalysisReport> {

    static final List<String> POSITIVE_WORDS = List.of(
            "great", "good", "excellent", "wonderful", "amazing", "love", "like",
            "happy", "pleased", "satisfied", "thanks", "thank", "appreciate");
    static final List<String> NEGATIVE_WORDS = List.of(
            "bad", "terrible", "awful", "hate", "dislike", "unhappy", "angry",
            "frustrated", "disappointed", "problem", "issue", "error", "wrong");
    static final List<String> ENGAGEMENT_INDICATORS = List.of(
            "question", "ask", "tell me", "explain", "how", "what", "why",
            "describe", "detail", "more", "elaborate");

    private static final double PROFILE_FIT_SCORE = 0.7;
    private static final int MAX_TOPICS = 5;
    private static final int MAX_GAPS = 5;

    private final int minMessages;

    public ConversationAnalystAgent(OrchestratorProperties properties) {
        this.minMessages = properties.getAnalysis().getMinMessages();
    }

    @Override
    public AgentName name() {
        return AgentName.CONVERSATION_ANALYST;
    }

    @Override
    protected AgentOutput<AnalysisReport> process(AgentInput input) {
        List<Message> conversation = conversationOf(input);
        if (conversation.size() < minMessages) {
            return AgentOutput.success(AnalysisReport.skipped(
                    "At least " + minMessages + " messages are needed for analysis"), 0);
        }

        List<String> userMessages = conversation.stream()
                .filter(m -> m.getRole() == Message.Role.user)
                .map(Message::getContent)
                .toList();
        String allText = conversation.stream().map(Message::getContent).collect(Collectors.joining(" "));

        Sentiment sentiment = sentiment(allText, conversation.size());
        List<Topic> topics = topics(allText, conversation.size());
        Patterns patterns = patterns(userMessages);
        Engagement engagement = engagement(userMessages);
        List<MemoryGap> gaps = memoryGaps(allText, input.getMemoryContext());
        Insights insights = insights(conversation.size(), sentiment, topics, patterns, engagement, gaps);
        List<Recommendation> recommendations = recommendations(sentiment, topics, patterns, engagement, gaps);

        log.info("Conversation analysed [sessionId={}, messages={}, sentiment={}, engagement={}, topics={}]",
                input.getSessionId(), conversation.size(), sentiment.label(), engagement.level(), topics.size());

        return AgentOutput.success(new AnalysisReport(false, null, sentiment, topics, patterns,
                engagement, gaps, insights, recommendations), 0);
    }

    private List<Message> conversationOf(AgentInput input) {
        List<Message> conversation = new ArrayList<>();
        input.getHistory().stream()
                .filter(m -> m.getRole() != Message.Role.system)
                .filter(m -> m.getContent() != null && !m.getContent().isBlank())
                .forEach(conversation::add);
        if (input.getMessage() != null && !input.getMessage().isBlank()) {
            conversation.add(Message.user(input.getMessage()));
        }
        if (input.getAssistantReply() != null && !input.getAssistantReply().isBlank()) {
            conversation.add(Message.assistant(input.getAssistantReply()));
        }
        return conversation;
    }

    Sentiment sentiment(String text, int messageCount) {
        int positive = (int) Keywords.countMatching(text, POSITIVE_WORDS);
        int negative = (int) Keywords.countMatching(text, NEGATIVE_WORDS);

        String label;
        double confidence;
        if (positive > negative) {
            label = "positive";
            confidence = Math.min(1.0, (double) positive / Math.max(1, messageCount));
        } else if (negative > positive) {
            label = "negative";
            confidence = Math.min(1.0, (double) negative / Math.max(1, messageCount));
        } else if (positive > 0) {
            label = "mixed";
            confidence = 0.5;
        } else {
            label = "neutral";
            confidence = 0.5;
        }
        return new Sentiment(label, round(confidence), positive, negative);
    }

    List<Topic> topics(String text, int messageCount) {
        List<Topic> topics = new ArrayList<>();
        for (Map.Entry<String, Integer> e : Keywords.frequencies(text).entrySet()) {
            double relevance = Math.min(1.0, (double) e.getValue() / Math.max(1, messageCount));
            if (relevance >= 0.1) {
                topics.add(new Topic(e.getKey(), round(relevance), e.getValue()));
            }
            if (topics.size() == MAX_TOPICS) {
                break;
            }
        }
        return topics;
    }

    Patterns patterns(List<String> userMessages) {
        List<String> found = new ArrayList<>();
        Map<String, Integer> frequencies = new LinkedHashMap<>();

        int questions = (int) userMessages.stream().filter(m -> m.contains("?")).count();
        if (questions >= 2) {
            found.add("frequent_questions");
            frequencies.put("frequent_questions", questions);
        }

        int recurring = (int) Keywords.frequencies(String.join(" ", userMessages)).values().stream()
                .filter(c -> c >= 3)
                .count();
        if (recurring > 0) {
            found.add("recurring_topics");
            frequencies.put("recurring_topics", recurring);
        }

        int engaged = (int) userMessages.stream().filter(m -> Keywords.containsAny(m, ENGAGEMENT_INDICATORS)).count();
        if (engaged >= 2) {
            found.add("high_engagement");
            frequencies.put("high_engagement", engaged);
        }
        return new Patterns(found, frequencies);
    }

    Engagement engagement(List<String> userMessages) {
        if (userMessages.isEmpty()) {
            return new Engagement(0.0, "low", 0, 0.0, 0, 0);
        }
        int total = userMessages.size();
        double avgLength = userMessages.stream().mapToInt(String::length).average().orElse(0);
        int indicators = (int) userMessages.stream().filter(m -> Keywords.containsAny(m, ENGAGEMENT_INDICATORS)).count();
        int questions = (int) userMessages.stream().filter(m -> m.contains("?")).count();

        double lengthScore = Math.min(1.0, avgLength / 100.0);
        double indicatorScore = Math.min(1.0, (double) indicators / total);
        double questionScore = Math.min(1.0, (double) questions / total);
        double score = lengthScore * 0.3 + indicatorScore * 0.4 + questionScore * 0.3;

        String level = score >= 0.7 ? "high" : score >= 0.4 ? "medium" : "low";
        return new Engagement(round(score), level, total, Math.round(avgLength * 10.0) / 10.0, indicators, questions);
    }

    /** Significant conversation words that no retrieved memory mentions. */
    List<MemoryGap> memoryGaps(String conversationText, String memoryContext) {
        Set<String> remembered = new HashSet<>(Keywords.words(memoryContext));
        return Keywords.frequencies(conversationText).keySet().stream()
                .filter(w -> !remembered.contains(w))
                .limit(MAX_GAPS)
                .map(w -> new MemoryGap(w, "Consider storing information about " + w))
                .toList();
    }

    private Insights insights(int messageCount, Sentiment sentiment, List<Topic> topics,
                              Patterns patterns, Engagement engagement, List<MemoryGap> gaps) {
        String summary = "Conversation with " + messageCount + " messages. "
                + "Overall sentiment: " + sentiment.label() + ". "
                + "Engagement level: " + engagement.level() + ".";

        Map<String, Double> distribution = new LinkedHashMap<>();
        topics.forEach(t -> distribution.put(t.topic(), t.relevance()));

        double coverage = Math.max(0.0, 1.0 - (double) gaps.size() / Math.max(1, topics.size()));
        return new Insights(summary, distribution, round(coverage), PROFILE_FIT_SCORE, patterns.patterns());
    }

    private List<Recommendation> recommendations(Sentiment sentiment, List<Topic> topics, Patterns patterns,
                                                 Engagement engagement, List<MemoryGap> gaps) {
        List<Recommendation> out = new ArrayList<>();
        if (!gaps.isEmpty()) {
            String sample = gaps.stream().limit(3).map(MemoryGap::topic).collect(Collectors.joining(", "));
            out.add(new Recommendation("memory_organization", "medium",
                    "Consider storing information about " + gaps.size() + " topics: " + sample,
                    "review_memory_gaps"));
        }
        if ("low".equals(engagement.level())) {
            out.add(new Recommendation("engagement", "high",
                    "User engagement is low. Consider asking more engaging questions.", "increase_engagement"));
        }
        if ("negative".equals(sentiment.label())) {
            out.add(new Recommendation("sentiment", "high",
                    "Negative sentiment detected. Consider adjusting approach.", "address_concerns"));
        }
        if (patterns.patterns().contains("recurring_topics")) {
            out.add(new Recommendation("pattern", "medium",
                    "Recurring topics detected. User may have strong interest in these areas.", "explore_topics"));
        }
        if (!topics.isEmpty()) {
            out.add(new Recommendation("follow_up", "low",
                    "Consider asking follow-up questions about " + topics.get(0).topic(), "suggest_questions"));
        }
        return out;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
