package com.deepansh.memorychat.agent.privacy;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex and keyword screening for personal and sensitive data.
 *
 * Pattern rules locate concrete PII (emails, card numbers, ...) that can be
 * redacted in place. Keyword rules only flag sensitive topics (finance, health).
 */
@Component
public class PiiDetector {

    private record PatternRule(String type, Severity severity, Pattern pattern, int group) {
    }

    private static final List<PatternRule> PATTERN_RULES = List.of(
            new PatternRule("email", Severity.LOW,
                    Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), 0),
            new PatternRule("credit_card", Severity.HIGH,
                    Pattern.compile("\\b\\d{4}[-.\\s]?\\d{4}[-.\\s]?\\d{4}[-.\\s]?\\d{4}\\b"), 0),
            new PatternRule("ssn", Severity.HIGH,
                    Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), 0),
            new PatternRule("phone", Severity.LOW,
                    Pattern.compile("(?<![\\d-])(\\+?\\d{1,3}[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}(?![\\d-])"), 0),
            new PatternRule("address", Severity.MEDIUM,
                    Pattern.compile("\\b\\d+\\s+[A-Za-z\\s]+(?:Street|St|Avenue|Ave|Road|Rd|Drive|Dr|Lane|Ln"
                            + "|Boulevard|Blvd|Court|Ct|Place|Pl)\\b[,\\s]+[A-Za-z\\s]+(?:,\\s*)?[A-Z]{2}\\s+\\d{5}",
                            Pattern.CASE_INSENSITIVE), 0),
            new PatternRule("date_of_birth", Severity.MEDIUM,
                    Pattern.compile("\\b(?:born|birth|dob|date of birth|birthday)[:\\s]+(\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4})\\b",
                            Pattern.CASE_INSENSITIVE), 1),
            new PatternRule("personal_name", Severity.MEDIUM,
                    Pattern.compile("\\b[A-Z][a-z]+\\s+[A-Z][a-z]+\\b"), 0));

    private static final List<String> NAME_FALSE_POSITIVES = List.of("the", "this", "that", "there", "then");

    static final List<String> FINANCIAL_KEYWORDS = List.of(
            "credit card", "debit card", "bank account", "routing number", "account number",
            "pin", "password", "social security", "ssn", "tax id", "salary", "income", "wage");

    static final List<String> HEALTH_KEYWORDS = List.of(
            "diagnosis", "medical condition", "prescription", "medication", "doctor", "hospital",
            "surgery", "treatment", "therapy", "medical history", "health insurance", "patient id");

    public List<PiiViolation> detect(String text) {
        List<PiiViolation> violations = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return violations;
        }

        for (PatternRule rule : PATTERN_RULES) {
            Matcher m = rule.pattern().matcher(text);
            while (m.find()) {
                if (rule.type().equals("credit_card") && m.group().replaceAll("[-.\\s]", "").length() != 16) {
                    continue;
                }
                if (rule.type().equals("personal_name") && isLikelyNotAName(m.group())) {
                    continue;
                }
                violations.add(new PiiViolation(rule.type(), rule.severity(),
                        m.start(rule.group()), m.end(rule.group()), true));
            }
        }

        addKeywordFindings(text, FINANCIAL_KEYWORDS, "financial_info", violations);
        addKeywordFindings(text, HEALTH_KEYWORDS, "health_info", violations);

        violations.sort(Comparator.comparingInt(PiiViolation::start));
        return violations;
    }

    /**
     * Masks every redactable finding with {@code [REDACTED_TYPE]}. Overlapping
     * findings are merged into the first (leftmost, then longest) one.
     */
    public String redact(String text, List<PiiViolation> violations) {
        List<PiiViolation> spans = violations.stream()
                .filter(PiiViolation::redactable)
                .sorted(Comparator.comparingInt(PiiViolation::start)
                        .thenComparing(Comparator.comparingInt(PiiViolation::end).reversed()))
                .toList();
        if (spans.isEmpty()) {
            return text;
        }

        StringBuilder sb = new StringBuilder();
        int cursor = 0;
        for (PiiViolation v : spans) {
            if (v.start() < cursor) {
                continue;
            }
            sb.append(text, cursor, v.start())
                    .append("[REDACTED_")
                    .append(v.type().toUpperCase(Locale.ROOT))
                    .append(']');
            cursor = v.end();
        }
        sb.append(text.substring(cursor));
        return sb.toString();
    }

    private void addKeywordFindings(String text, List<String> keywords, String type, List<PiiViolation> out) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            Matcher m = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(lower);
            while (m.find()) {
                out.add(new PiiViolation(type, Severity.HIGH, m.start(), m.end(), false));
            }
        }
    }

    private boolean isLikelyNotAName(String candidate) {
        String[] words = candidate.toLowerCase(Locale.ROOT).split("\\s+");
        for (String w : words) {
            if (NAME_FALSE_POSITIVES.contains(w)) {
                return true;
            }
        }
        return false;
    }
}
