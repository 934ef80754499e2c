package com.deepansh.memorychat.agent.privacy;

import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.model.PrivacyMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrivacyGuardianAgentTest {

    private OrchestratorProperties props;
    private PrivacyGuardianAgent agent;

    @BeforeEach
    void setUp() {
        props = new OrchestratorProperties();
        agent = new PrivacyGuardianAgent(new PiiDetector(), props);
    }

    @Test
    void execute_normalWithoutFindings_allowedWithoutWarnings() {
        PrivacyVerdict verdict = verdict(input(PrivacyMode.NORMAL, "what is a good pasta recipe?"));

        assertThat(verdict.allowed()).isTrue();
        assertThat(verdict.warnings()).isEmpty();
        assertThat(verdict.sanitizedMode()).isEqualTo(PrivacyMode.NORMAL);
        assertThat(verdict.sanitizedMessage()).isEqualTo("what is a good pasta recipe?");
    }

    @Test
    void execute_normalWithEmail_warnsButKeepsMessage() {
        PrivacyVerdict verdict = verdict(input(PrivacyMode.NORMAL, "reach me at a@b.io"));

        assertThat(verdict.allowed()).isTrue();
        assertThat(verdict.sanitizedMessage()).isEqualTo("reach me at a@b.io");
        assertThat(verdict.warnings()).singleElement().asString().contains("email");
    }

    @Test
    void execute_incognitoWithEmail_redactsAndStaysAllowed() {
        PrivacyVerdict verdict = verdict(input(PrivacyMode.INCOGNITO, "reach me at a@b.io"));

        assertThat(verdict.allowed()).isTrue();
        assertThat(verdict.sanitizedMessage()).isEqualTo("reach me at [REDACTED_EMAIL]");
        assertThat(verdict.violations()).hasSize(1);
    }

    @Test
    void execute_pauseMemories_alwaysWarns() {
        PrivacyVerdict verdict = verdict(input(PrivacyMode.PAUSE_MEMORIES, "hello there"));

        assertThat(verdict.sanitizedMode()).isEqualTo(PrivacyMode.PAUSE_MEMORIES);
        assertThat(verdict.warnings()).containsExactly("Memory storage is paused; nothing from this turn will be saved");
    }

    @Test
    void execute_profileMismatch_downgradesToIncognito() {
        AgentInput input = input(PrivacyMode.NORMAL, "hello there")
                .withProfileId("personal")
                .withSessionProfileId("work");

        PrivacyVerdict verdict = verdict(input);

        assertThat(verdict.sanitizedMode()).isEqualTo(PrivacyMode.INCOGNITO);
        assertThat(verdict.warnings()).anyMatch(w -> w.contains("does not match"));
    }

    @Test
    void execute_nullAndDefaultProfile_areTheSameProfile() {
        AgentInput input = input(PrivacyMode.NORMAL, "hello there")
                .withProfileId(null)
                .withSessionProfileId("default");

        assertThat(verdict(input).sanitizedMode()).isEqualTo(PrivacyMode.NORMAL);
    }

    @Test
    void execute_highSeverityWithBlocking_notAllowed() {
        props.getPrivacy().setBlockHighSeverity(true);
        agent = new PrivacyGuardianAgent(new PiiDetector(), props);

        PrivacyVerdict verdict = verdict(input(PrivacyMode.NORMAL, "my bank account is overdrawn"));

        assertThat(verdict.allowed()).isFalse();
        assertThat(verdict.highSeverityCount()).isEqualTo(1);
    }

    @Test
    void execute_highSeverityWithoutBlocking_allowed() {
        assertThat(verdict(input(PrivacyMode.NORMAL, "my bank account is overdrawn")).allowed()).isTrue();
    }

    @Test
    void execute_reportsZeroTokens() {
        AgentOutput<PrivacyVerdict> output = agent.execute(input(PrivacyMode.NORMAL, "hello there"));
        assertThat(output.getTokensUsed()).isZero();
    }

    private PrivacyVerdict verdict(AgentInput input) {
        AgentOutput<PrivacyVerdict> output = agent.execute(input);
        assertThat(output.isSuccess()).isTrue();
        return output.getData();
    }

    private static AgentInput input(PrivacyMode mode, String message) {
        return AgentInput.builder().sessionId("s1").userId("u1").message(message).privacyMode(mode).build();
    }
}
