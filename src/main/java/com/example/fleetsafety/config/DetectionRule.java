package com.example.fleetsafety.config;

import com.example.fleetsafety.detection.RuleAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

/**
 * A detection rule: fires when every label in {@code conditions} is present
 * on a signal. {@code channels} and {@code recipients} override the
 * escalation matrix for immediate notifications.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRule {

    private String id;
    private List<String> conditions;
    private String action;
    private List<String> channels;
    private List<String> recipients;

    public RuleAction resolvedAction() {
        return RuleAction.fromValue(action);
    }

    public boolean hasConditions() {
        return conditions != null && conditions.stream().anyMatch(c -> c != null && !c.isBlank());
    }

    /** Single-label rule built from the legacy flat label list. */
    public static DetectionRule migrated(String label) {
        return DetectionRule.builder()
                .id("migrated-" + label.toLowerCase(Locale.ROOT))
                .conditions(List.of(label))
                .action(RuleAction.AI_PIPELINE.value())
                .build();
    }
}
