package com.deepansh.memorychat.agent.privacy;

import com.deepansh.memorychat.model.PrivacyMode;

import java.util.List;

/**
 * @param allowed          false only when hard blocking is enabled and high-severity content was found
 * @param sanitizedMode    the mode every later stage must honour
 * @param sanitizedMessage the message forwarded downstream (PII masked in incognito)
 */
public record PrivacyVerdict(boolean allowed,
                             List<String> warnings,
                             PrivacyMode sanitizedMode,
                             String sanitizedMessage,
                             List<PiiViolation> violations) {

    public PrivacyVerdict {
        warnings = List.copyOf(warnings);
        violations = List.copyOf(violations);
    }

    public long highSeverityCount() {
        return violations.stream().filter(v -> v.severity() == Severity.HIGH).count();
    }
}
