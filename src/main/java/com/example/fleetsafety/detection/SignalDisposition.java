package com.example.fleetsafety.detection;

import com.example.fleetsafety.config.DetectionRule;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.NotificationDecision;
import com.example.fleetsafety.domain.Signal;

/**
 * Outcome of ingesting one signal. {@code rule}, {@code action} and
 * {@code alert} are null when no alert was opened.
 */
public record SignalDisposition(Signal signal, boolean created, DetectionRule rule, RuleAction action,
                                Alert alert, NotificationDecision immediateDecision) {

    public boolean alertCreated() {
        return alert != null;
    }
}
