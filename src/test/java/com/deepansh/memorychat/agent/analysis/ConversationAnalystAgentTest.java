package com.deepansh.memorychat.agent.analysis;

import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationAnalystAgentTest {

    private ConversationAnalystAgent agent;

    @BeforeEach
    void setUp() {
        agent = new ConversationAnalystAgent(new OrchestratorProperties());
    }

    @Test
    void execute_singleMessage_isSkipped() {
        AgentInput input = AgentInput.builder().sessionId("s1").message("hello").build();

        AgentOutput<AnalysisReport> output = agent.execute(input);

        assertThat(output.isSuccess()).isTrue();
        assertThat(output.getData().skipped()).isTrue();
        assertThat(output.getData().skipReason()).contains("2 messages");
    }

    @Test
    void execute_fullConversation_producesReportWithZeroTokens() {
        AgentInput input = AgentInput.builder()
                .sessionId("s1")
                .history(List.of(
                        Message.user("How do I bake sourdough bread?"),
                        Message.assistant("Start with an active sourdough starter.")))
                .message("What flour works best for sourdough?")
                .assistantReply("Bread flour gives sourdough a good structure. Great question!")
                .memoryContext("1. Enjoys baking bread")
                .build();

        AgentOutput<AnalysisReport> output = agent.execute(input);
        AnalysisReport report = output.getData();

        assertThat(output.getTokensUsed()).isZero();
        assertThat(report.skipped()).isFalse();
        assertThat(report.topics()).extracting(AnalysisReport.Topic::topic).startsWith("sourdough");
        assertThat(report.patterns().patterns()).contains("frequent_questions", "high_engagement");
        assertThat(report.memoryGaps()).extracting(AnalysisReport.MemoryGap::topic)
                .contains("sourdough")
                .doesNotContain("bread");
        assertThat(report.insights().profileFitScore()).isEqualTo(0.7);
        assertThat(report.recommendations()).extracting(AnalysisReport.Recommendation::type)
                .contains("memory_organization", "follow_up");
    }

    @Test
    void sentiment_labelsByIndicatorBalance() {
        assertThat(agent.sentiment("great work, thanks", 2).label()).isEqualTo("positive");
        assertThat(agent.sentiment("this is a terrible problem", 2).label()).isEqualTo("negative");
        assertThat(agent.sentiment("good but wrong", 2).label()).isEqualTo("mixed");
        assertThat(agent.sentiment("the sky is blue", 2).label()).isEqualTo("neutral");
    }

    @Test
    void sentiment_confidenceCappedAtOne() {
        assertThat(agent.sentiment("great good excellent amazing", 2).confidence()).isEqualTo(1.0);
    }

    @Test
    void engagement_longQuestionsWithIndicators_isHigh() {
        String longQuestion = "Can you explain in detail how the fermentation process works for sourdough bread and why?"
                + " I want every step.";

        AnalysisReport.Engagement engagement = agent.engagement(List.of(longQuestion, longQuestion));

        assertThat(engagement.level()).isEqualTo("high");
        assertThat(engagement.questions()).isEqualTo(2);
    }

    @Test
    void engagement_shortStatements_isLow() {
        AnalysisReport.Engagement engagement = agent.engagement(List.of("ok", "sure"));

        assertThat(engagement.level()).isEqualTo("low");
        assertThat(engagement.score()).isLessThan(0.4);
    }

    @Test
    void patterns_recurringTopicNeedsThreeMentions() {
        AnalysisReport.Patterns patterns = agent.patterns(List.of(
                "garden tips", "garden soil", "garden pests"));

        assertThat(patterns.patterns()).contains("recurring_topics");
        assertThat(patterns.frequencies()).containsEntry("recurring_topics", 1);
    }

    @Test
    void memoryGaps_limitedToFive() {
        List<AnalysisReport.MemoryGap> gaps = agent.memoryGaps(
                "alpha bravo charlie delta echo foxtrot golf hotel", "");

        assertThat(gaps).hasSize(5);
    }
}
