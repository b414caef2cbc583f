package com.example.fleetsafety.domain;

import lombok.Getter;

/** Raised when an alert's AI status would move outside its transition table. */
@Getter
public class IllegalAlertTransitionException extends IllegalStateException {

    private final String alertId;
    private final Alert.AiStatus from;
    private final Alert.AiStatus to;

    public IllegalAlertTransitionException(String alertId, Alert.AiStatus from, Alert.AiStatus to) {
        super("Alert " + alertId + " cannot move from " + from.value() + " to " + to.value());
        this.alertId = alertId;
        this.from = from;
        this.to = to;
    }
}
