package com.example.fleetsafety.detection;

import com.example.fleetsafety.config.CompanyConfig;
import com.example.fleetsafety.config.DetectionRule;
import com.example.fleetsafety.domain.Signal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates a signal against a company's detection rules.
 *
 * Rules are checked in declaration order and the first rule whose conditions
 * are all present on the signal wins. A disabled or empty rule set never
 * matches. No side effects.
 */
@Slf4j
@Component
public class RuleMatcher {

    public Optional<DetectionRule> match(Signal signal, CompanyConfig config) {
        CompanyConfig.SafetyStreamNotify notify = config.getSafetyStreamNotify();
        if (notify == null || !notify.isActive()) {
            return Optional.empty();
        }

        List<DetectionRule> rules = notify.effectiveRules();
        if (rules.isEmpty()) {
            return Optional.empty();
        }

        List<String> canonical = config.getCanonicalLabels();
        List<String> labels = BehaviorLabels.normalizedLabels(signal, canonical);
        if (labels.isEmpty()) {
            return Optional.empty();
        }

        for (DetectionRule rule : rules) {
            if (!rule.hasConditions()) {
                continue;
            }
            Set<String> conditions = BehaviorLabels.normalizeAll(rule.getConditions(), canonical);
            if (labels.containsAll(conditions)) {
                log.debug("Signal {} matched rule {} (labels={})", signal.getSourceEventId(), rule.getId(), labels);
                return Optional.of(rule);
            }
        }

        log.debug("Signal {} matched no rule (labels={})", signal.getSourceEventId(), labels);
        return Optional.empty();
    }
}
