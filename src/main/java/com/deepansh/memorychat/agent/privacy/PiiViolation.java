package com.deepansh.memorychat.agent.privacy;

/**
 * One finding. The matched text itself is deliberately not kept so findings can
 * be logged and returned to the UI without re-leaking the content.
 *
 * @param type      email, phone, credit_card, ssn, address, date_of_birth,
 *                  personal_name, financial_info or health_info
 * @param redactable true for pattern matches that can be masked in place;
 *                  false for topic keywords
 */
public record PiiViolation(String type, Severity severity, int start, int end, boolean redactable) {
}
