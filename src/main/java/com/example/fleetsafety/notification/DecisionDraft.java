package com.example.fleetsafety.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Attributes of a decision before it is persisted. {@code escalationLevel} is
 * raw input and is normalized on creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionDraft {

    private boolean shouldNotify;
    private String escalationLevel;
    private String messageText;
    private String callScript;
    private String reason;
    private String dedupeKey;
    private List<String> channels;
}
