package com.deepansh.memorychat.agent.privacy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PiiDetectorTest {

    private final PiiDetector detector = new PiiDetector();

    @Test
    void detect_plainText_findsNothing() {
        assertThat(detector.detect("what should i cook tonight?")).isEmpty();
    }

    @Test
    void detect_email_isLowSeverity() {
        List<PiiViolation> found = detector.detect("write to jane.doe@example.com later");

        assertThat(found).singleElement().satisfies(v -> {
            assertThat(v.type()).isEqualTo("email");
            assertThat(v.severity()).isEqualTo(Severity.LOW);
            assertThat(v.redactable()).isTrue();
        });
    }

    @Test
    void detect_ssn_isHighSeverity() {
        assertThat(detector.detect("mine is 123-45-6789"))
                .extracting(PiiViolation::type)
                .contains("ssn");
    }

    @Test
    void detect_creditCard_requiresSixteenDigits() {
        assertThat(detector.detect("card 4111 1111 1111 1111"))
                .extracting(PiiViolation::type).contains("credit_card");
        assertThat(detector.detect("order 1234 5678 9012"))
                .extracting(PiiViolation::type).doesNotContain("credit_card");
    }

    @Test
    void detect_phone() {
        assertThat(detector.detect("call me on 555-123-4567"))
                .extracting(PiiViolation::type).containsExactly("phone");
    }

    @Test
    void detect_dateOfBirth_onlyNearContextWord() {
        assertThat(detector.detect("i was born: 04/12/1990"))
                .extracting(PiiViolation::type).contains("date_of_birth");
        assertThat(detector.detect("the meeting is 04/12/1990"))
                .extracting(PiiViolation::type).doesNotContain("date_of_birth");
    }

    @Test
    void detect_personalName_skipsCommonFalsePositives() {
        assertThat(detector.detect("I met Jane Smith today"))
                .extracting(PiiViolation::type).contains("personal_name");
        assertThat(detector.detect("The Weather was nice"))
                .extracting(PiiViolation::type).doesNotContain("personal_name");
    }

    @Test
    void detect_healthKeyword_isHighAndNotRedactable() {
        assertThat(detector.detect("my doctor changed my medication"))
                .filteredOn(v -> v.type().equals("health_info"))
                .hasSize(2)
                .allSatisfy(v -> {
                    assertThat(v.severity()).isEqualTo(Severity.HIGH);
                    assertThat(v.redactable()).isFalse();
                });
    }

    @Test
    void detect_keywordsMatchWholeWordsOnly() {
        assertThat(detector.detect("spinach pie recipe")).isEmpty();
    }

    @Test
    void redact_replacesOnlyRedactableSpans() {
        String text = "email jane@example.com about my salary";

        String redacted = detector.redact(text, detector.detect(text));

        assertThat(redacted).isEqualTo("email [REDACTED_EMAIL] about my salary");
    }

    @Test
    void redact_overlappingFindings_mergedIntoFirst() {
        String text = "x 123-45-6789 y";
        List<PiiViolation> overlapping = List.of(
                new PiiViolation("ssn", Severity.HIGH, 2, 13, true),
                new PiiViolation("phone", Severity.LOW, 6, 13, true));

        assertThat(detector.redact(text, overlapping)).isEqualTo("x [REDACTED_SSN] y");
    }
}
