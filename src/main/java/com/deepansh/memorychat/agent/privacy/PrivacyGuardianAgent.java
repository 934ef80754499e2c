package com.deepansh.memorychat.agent.privacy;

import com.deepansh.memorychat.agent.AbstractAgent;
import com.deepansh.memorychat.agent.AgentInput;
import com.deepansh.memorychat.agent.AgentName;
import com.deepansh.memorychat.agent.AgentOutput;
import com.deepansh.memorychat.config.OrchestratorProperties;
import com.deepansh.memorychat.memory.MemoryNamespace;
import com.deepansh.memorychat.model.PrivacyMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * First stage of every turn. Screens the message and fixes the privacy mode the
 * rest of the pipeline must honour.
 *
 * - normal: allowed; findings produce a warning that they may be remembered
 * - incognito: allowed; findings are flagged and masked in the forwarded message
 * - pause_memories: allowed; always warns that nothing will be stored
 *
 * A session bound to a different profile than the one requested is downgraded
 * to incognito for the turn so memories never cross profiles.
 */
@Component
@Slf4j
public class PrivacyGuardianAgent extends AbstractAgent<PrivacyVerdict> {

    private final PiiDetector detector;
    private final boolean blockHighSeverity;

    public PrivacyGuardianAgent(PiiDetector detector, OrchestratorProperties properties) {
        this.detector = detector;
        this.blockHighSeverity = properties.getPrivacy().isBlockHighSeverity();
    }

    @Override
    public AgentName name() {
        return AgentName.PRIVACY_GUARDIAN;
    }

    @Override
    protected AgentOutput<PrivacyVerdict> process(AgentInput input) {
        String message = input.getMessage();
        List<PiiViolation> violations = detector.detect(message);
        List<String> warnings = new ArrayList<>();
        PrivacyMode mode = input.getPrivacyMode();

        if (mode.allowsRetrieval() && profileMismatch(input)) {
            warnings.add("Requested profile does not match this session's profile; memory is disabled for this turn");
            mode = PrivacyMode.INCOGNITO;
        }

        String sanitized = message;
        String found = describe(violations);
        switch (mode) {
            case NORMAL -> {
                if (!violations.isEmpty()) {
                    warnings.add("Sensitive information detected (" + found + "); it may be saved to long-term memory");
                }
            }
            case INCOGNITO -> {
                if (!violations.isEmpty()) {
                    sanitized = detector.redact(message, violations);
                    warnings.add("Sensitive information detected (" + found + "); personal details were redacted");
                }
            }
            case PAUSE_MEMORIES -> {
                warnings.add("Memory storage is paused; nothing from this turn will be saved");
                if (!violations.isEmpty()) {
                    warnings.add("Sensitive information detected (" + found + ")");
                }
            }
        }

        PrivacyVerdict verdict = new PrivacyVerdict(true, warnings, mode, sanitized, violations);
        if (blockHighSeverity && verdict.highSeverityCount() > 0) {
            warnings.add("Message blocked: it contains high-severity sensitive information");
            verdict = new PrivacyVerdict(false, warnings, mode, sanitized, violations);
        }

        log.info("Privacy check [sessionId={}, requestedMode={}, effectiveMode={}, violations={}, high={}, allowed={}]",
                input.getSessionId(), input.getPrivacyMode().getValue(), mode.getValue(),
                violations.size(), verdict.highSeverityCount(), verdict.allowed());

        return AgentOutput.success(verdict, 0);
    }

    private boolean profileMismatch(AgentInput input) {
        if (input.getSessionProfileId() == null) {
            return false;
        }
        return !Objects.equals(
                MemoryNamespace.of(input.getUserId(), input.getSessionProfileId()),
                MemoryNamespace.of(input.getUserId(), input.getProfileId()));
    }

    private String describe(List<PiiViolation> violations) {
        return String.join(", ", violations.stream().map(PiiViolation::type).distinct().toList());
    }
}
