package com.example.fleetsafety.event;

/**
 * The AI pipeline should pick up the alert. Listeners run the triage job and
 * report back through {@code AlertLifecycleService} / {@code RevalidationService}.
 */
public record AlertTriageRequestedEvent(String alertId, Long companyId, String ruleId) {
}
