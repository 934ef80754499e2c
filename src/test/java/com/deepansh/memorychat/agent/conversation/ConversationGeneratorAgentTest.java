package com.deepansh.memorychat.agent.conversation;

import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.agent.ErrorKind;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.exception.ProviderFatalException;
import com.deepansh.memorychat.exception.ProviderTransientException;
import com.deepansh.memorychat.llm.LlmClient;
import com.deepansh.memorychat.model.LlmResponse;
import com.deepansh.memorychat.model.LlmStreamChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationGeneratorAgentTest {

    @Mock LlmClient llmClient;

    private ConversationGeneratorAgent agent;

    @BeforeEach
    void setUp() {
        OrchestratorProperties props = new OrchestratorProperties();
        props.getGeneration().setTemperature(0.5);
        props.getGeneration().setMaxTokens(256);
        agent = new ConversationGeneratorAgent(llmClient, new PromptBuilder(props), props);
    }

    @Test
    void execute_usesProviderReportedTokens() {
        when(llmClient.complete(anyList(), eq(0.5), eq(256))).thenReturn(LlmResponse.builder()
                .content("Hi there!").finishReason("stop").promptTokens(90).completionTokens(30).build());

        AgentOutput<GenerationResult> output = agent.execute(input());

        assertThat(output.isSuccess()).isTrue();
        assertThat(output.getData()).isEqualTo(new GenerationResult("Hi there!", "stop"));
        assertThat(output.getTokensUsed()).isEqualTo(120);
    }

    @Test
    void execute_noUsageReported_estimatesTokens() {
        when(llmClient.complete(anyList(), anyDouble(), anyInt())).thenReturn(LlmResponse.builder()
                .content("Hi there!").finishReason("stop").build());

        AgentOutput<GenerationResult> output = agent.execute(input());

        assertThat(output.getTokensUsed()).isPositive();
    }

    @Test
    void execute_transientFailure_keepsErrorKind() {
        when(llmClient.complete(anyList(), anyDouble(), anyInt()))
                .thenThrow(new ProviderTransientException("upstream 503"));

        AgentOutput<GenerationResult> output = agent.execute(input());

        assertThat(output.isSuccess()).isFalse();
        assertThat(output.getError().kind()).isEqualTo(ErrorKind.PROVIDER_TRANSIENT_ERROR);
        assertThat(output.getError().message()).isEqualTo("upstream 503");
    }

    @Test
    void execute_fatalFailure_keepsErrorKind() {
        when(llmClient.complete(anyList(), anyDouble(), anyInt()))
                .thenThrow(new ProviderFatalException("invalid api key"));

        assertThat(agent.execute(input()).getError().kind()).isEqualTo(ErrorKind.PROVIDER_FATAL_ERROR);
    }

    @Test
    void execute_blankReply_isFatal() {
        when(llmClient.complete(anyList(), anyDouble(), anyInt())).thenReturn(LlmResponse.builder()
                .content("  ").finishReason("content_filter").build());

        AgentOutput<GenerationResult> output = agent.execute(input());

        assertThat(output.isSuccess()).isFalse();
        assertThat(output.getError().kind()).isEqualTo(ErrorKind.PROVIDER_FATAL_ERROR);
        assertThat(output.getError().message()).contains("content_filter");
    }

    @Test
    void executeStreaming_forwardsDeltasAndAssemblesReply() {
        doAnswer(inv -> {
            Consumer<LlmStreamChunk> sink = inv.getArgument(3);
            sink.accept(LlmStreamChunk.delta("Hi "));
            sink.accept(LlmStreamChunk.delta("there"));
            sink.accept(LlmStreamChunk.finished("stop"));
            return null;
        }).when(llmClient).stream(anyList(), anyDouble(), anyInt(), any());
        List<String> deltas = new ArrayList<>();

        AgentOutput<GenerationResult> output = agent.executeStreaming(input(), deltas::add);

        assertThat(deltas).containsExactly("Hi ", "there");
        assertThat(output.getData()).isEqualTo(new GenerationResult("Hi there", "stop"));
    }

    @Test
    void executeStreaming_nothingStreamed_isFatal() {
        doAnswer(inv -> {
            Consumer<LlmStreamChunk> sink = inv.getArgument(3);
            sink.accept(LlmStreamChunk.finished("stop"));
            return null;
        }).when(llmClient).stream(anyList(), anyDouble(), anyInt(), any());

        AgentOutput<GenerationResult> output = agent.executeStreaming(input(), delta -> { });

        assertThat(output.getError().kind()).isEqualTo(ErrorKind.PROVIDER_FATAL_ERROR);
    }

    private static AgentInput input() {
        return AgentInput.builder().sessionId("s1").message("hello").build();
    }
}
