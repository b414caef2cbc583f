package com.example.fleetsafety.detection;

import com.example.fleetsafety.config.FleetSafetyProperties;
import com.example.fleetsafety.domain.Severity;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Derives signal severity from its labels: any critical label wins, then any
 * warning label, else info.
 */
@Component
public class SeverityClassifier {

    private final Set<String> criticalLabels;
    private final Set<String> warningLabels;

    public SeverityClassifier(FleetSafetyProperties properties) {
        this.criticalLabels = new HashSet<>(properties.getSeverity().getCriticalLabels());
        this.warningLabels = new HashSet<>(properties.getSeverity().getWarningLabels());
    }

    public Severity classify(Collection<String> labels) {
        if (labels == null || labels.isEmpty()) return Severity.INFO;
        if (labels.stream().anyMatch(criticalLabels::contains)) return Severity.CRITICAL;
        if (labels.stream().anyMatch(warningLabels::contains)) return Severity.WARNING;
        return Severity.INFO;
    }
}
