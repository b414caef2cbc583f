package com.example.fleetsafety.detection;

import java.util.Locale;

public enum RuleAction {
    AI_PIPELINE, IMMEDIATE_NOTIFY, BOTH;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean runsAiPipeline() {
        return switch (this) {
            case AI_PIPELINE, BOTH -> true;
            case IMMEDIATE_NOTIFY -> false;
        };
    }

    public boolean notifiesImmediately() {
        return switch (this) {
            case IMMEDIATE_NOTIFY, BOTH -> true;
            case AI_PIPELINE -> false;
        };
    }

    /** Legacy {@code notify} and unknown actions route to the AI pipeline. */
    public static RuleAction fromValue(String value) {
        if (value == null) return AI_PIPELINE;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "immediate_notify", "notify_immediate" -> IMMEDIATE_NOTIFY;
            case "both" -> BOTH;
            default -> AI_PIPELINE;
        };
    }
}
