package com.example.fleetsafety.event;

/** A decision was persisted; dispatch reads it by id. */
public record NotificationDecisionRecordedEvent(String decisionId, String alertId, boolean shouldNotify) {
}
