package com.example.fleetsafety.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-company configuration tree.
 *
 * Every field is nullable: a null field means "not set at this layer" and is
 * filled in from the layer below by {@link CompanyConfigMerger}. A fully
 * resolved config (see {@link CompanyConfigResolver}) has every section set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyConfig {

    private InvestigationWindows investigationWindows;
    private Monitoring monitoring;
    private UsageLimits usageLimits;
    private Map<String, EscalationRoute> escalationMatrix;
    private EscalationPolicy escalationPolicy;
    private Map<String, SlaPolicy> slaPolicies;
    private SafetyStreamNotify safetyStreamNotify;
    private StaleVehicleMonitor staleVehicleMonitor;
    private Incidents incidents;
    private Attention attention;
    private List<String> canonicalLabels;
    private Map<String, ContactPoint> contacts;

    /**
     * Context windows handed to the triage pipeline when it gathers evidence.
     * Merged and exposed through {@link CompanyConfigResolver}; nothing in the
     * alert lifecycle reads them.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InvestigationWindows {
        private Integer correlationWindowMinutes;
        private Integer mediaWindowSeconds;
        private Integer safetyEventsBeforeMinutes;
        private Integer safetyEventsAfterMinutes;
        private Integer vehicleStatsBeforeMinutes;
        private Integer vehicleStatsAfterMinutes;
        private Integer cameraMediaWindowMinutes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Monitoring {
        /** Read by the triage pipeline when it decides to keep monitoring. */
        private Double confidenceThreshold;
        private List<Integer> checkIntervals;
        /** Triage-side cap; the lifecycle budget comes from usage limits. */
        private Integer maxRevalidations;

        /**
         * Adaptive wait before the next revalidation: the interval at
         * {@code investigationCount}, clamped to the last configured one.
         */
        public int nextCheckMinutes(int investigationCount) {
            if (checkIntervals == null || checkIntervals.isEmpty()) {
                return 15;
            }
            int index = Math.max(0, Math.min(investigationCount, checkIntervals.size() - 1));
            return checkIntervals.get(index);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UsageLimits {
        private Integer maxRevalidationsPerEvent;
    }

    /** One row of the escalation matrix: who gets told and how. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EscalationRoute {
        private List<String> channels;
        private List<String> recipients;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EscalationPolicy {
        private Integer intervalMinutes;
        private Integer maxEscalations;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SlaPolicy {
        private Integer ackMinutes;
        private Integer resolveMinutes;
    }

    /**
     * Detection rules for the safety event stream. {@code labels} is the
     * legacy form: a flat list of labels, each of which becomes a single
     * condition rule routed to the AI pipeline.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SafetyStreamNotify {
        private Boolean enabled;
        private List<DetectionRule> rules;
        private List<String> labels;

        public boolean isActive() {
            return !Boolean.FALSE.equals(enabled);
        }

        public List<DetectionRule> effectiveRules() {
            if (rules != null) {
                return rules;
            }
            List<DetectionRule> migrated = new ArrayList<>();
            if (labels != null) {
                for (String label : labels) {
                    if (label != null && !label.isBlank()) {
                        migrated.add(DetectionRule.migrated(label));
                    }
                }
            }
            return migrated;
        }
    }

    /** Settings for the stale-vehicle watcher; merged here, consumed by that watcher. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StaleVehicleMonitor {
        private Boolean enabled;
        private Integer thresholdMinutes;
        private List<String> channels;
        private List<String> recipients;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Incidents {
        private Integer dedupeWindowMinutes;
        private Integer signalSearchWindowMinutes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Attention {
        private Boolean enabled;
    }

    /**
     * Defaults applied when neither the service-wide nor the company layer
     * sets a value.
     */
    public static CompanyConfig builtIn() {
        Map<String, EscalationRoute> matrix = new LinkedHashMap<>();
        matrix.put("monitor", new EscalationRoute(List.of(), List.of()));
        matrix.put("warn", new EscalationRoute(List.of("whatsapp", "sms"), List.of("monitoring_team")));
        matrix.put("call", new EscalationRoute(List.of("call", "whatsapp", "sms"),
                List.of("monitoring_team", "supervisor")));
        matrix.put("emergency", new EscalationRoute(List.of("call", "whatsapp", "sms"),
                List.of("monitoring_team", "supervisor", "emergency")));

        Map<String, SlaPolicy> sla = new LinkedHashMap<>();
        sla.put("critical", new SlaPolicy(5, 60));
        sla.put("warning", new SlaPolicy(15, 240));
        sla.put("info", new SlaPolicy(60, 1440));

        return CompanyConfig.builder()
                .investigationWindows(new InvestigationWindows(20, 120, 30, 10, 5, 2, 2))
                .monitoring(new Monitoring(0.80, List.of(5, 15, 30, 60), 3))
                .usageLimits(new UsageLimits(3))
                .escalationMatrix(matrix)
                .escalationPolicy(new EscalationPolicy(10, 3))
                .slaPolicies(sla)
                .safetyStreamNotify(new SafetyStreamNotify(true, null,
                        List.of("Crash", "ForwardCollisionWarning", "SevereSpeeding")))
                .staleVehicleMonitor(new StaleVehicleMonitor(false, 30, List.of("whatsapp"),
                        List.of("monitoring_team")))
                .incidents(new Incidents(30, 5))
                .attention(new Attention(true))
                .canonicalLabels(List.of(
                        "Braking", "Crash", "Drowsy", "EdgeRailroadCrossingViolation",
                        "ForwardCollisionWarning", "GenericDistraction", "HarshTurn", "MaxSpeed",
                        "MobileUsage", "NoSeatbelt", "ObstructedCamera", "Passenger", "RollingStop",
                        "SevereSpeeding", "Collision", "NearCollision", "NearCollison",
                        "NearPedestrianCollision", "RearCollisionWarning", "HeavySpeeding",
                        "HighSpeedSuddenDisconnect", "Acceleration", "Speeding", "ModerateSpeeding",
                        "FollowingDistance", "FollowingDistanceSevere", "RanRedLight"))
                .contacts(new LinkedHashMap<>())
                .build();
    }
}
