package com.example.fleetsafety.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BinaryOperator;

/**
 * Layers one {@link CompanyConfig} over another.
 *
 * Merge rules:
 * - null in the override means "absent" and keeps the base value
 * - scalars in the override replace the base value
 * - maps (escalation matrix, SLA policies, contacts) merge per key
 * - lists replace the base list wholesale
 */
public final class CompanyConfigMerger {

    private CompanyConfigMerger() {
    }

    public static CompanyConfig merge(CompanyConfig base, CompanyConfig override) {
        if (base == null) return override;
        if (override == null) return base;

        return CompanyConfig.builder()
                .investigationWindows(mergeWindows(base.getInvestigationWindows(), override.getInvestigationWindows()))
                .monitoring(mergeMonitoring(base.getMonitoring(), override.getMonitoring()))
                .usageLimits(mergeUsageLimits(base.getUsageLimits(), override.getUsageLimits()))
                .escalationMatrix(mergeMap(base.getEscalationMatrix(), override.getEscalationMatrix(),
                        CompanyConfigMerger::mergeRoute))
                .escalationPolicy(mergePolicy(base.getEscalationPolicy(), override.getEscalationPolicy()))
                .slaPolicies(mergeMap(base.getSlaPolicies(), override.getSlaPolicies(),
                        CompanyConfigMerger::mergeSla))
                .safetyStreamNotify(mergeNotify(base.getSafetyStreamNotify(), override.getSafetyStreamNotify()))
                .staleVehicleMonitor(mergeStale(base.getStaleVehicleMonitor(), override.getStaleVehicleMonitor()))
                .incidents(mergeIncidents(base.getIncidents(), override.getIncidents()))
                .attention(mergeAttention(base.getAttention(), override.getAttention()))
                .canonicalLabels(pick(base.getCanonicalLabels(), override.getCanonicalLabels()))
                .contacts(mergeMap(base.getContacts(), override.getContacts(), CompanyConfigMerger::mergeContact))
                .build();
    }

    private static <T> T pick(T base, T override) {
        return override != null ? override : base;
    }

    private static <V> Map<String, V> mergeMap(Map<String, V> base, Map<String, V> override,
                                               BinaryOperator<V> valueMerger) {
        if (base == null) return override;
        if (override == null) return base;
        Map<String, V> merged = new LinkedHashMap<>(base);
        override.forEach((key, value) -> {
            if (value != null) merged.merge(key, value, valueMerger);
        });
        return merged;
    }

    private static CompanyConfig.InvestigationWindows mergeWindows(CompanyConfig.InvestigationWindows base,
                                                                   CompanyConfig.InvestigationWindows override) {
        if (base == null || override == null) return pick(base, override);
        return new CompanyConfig.InvestigationWindows(
                pick(base.getCorrelationWindowMinutes(), override.getCorrelationWindowMinutes()),
                pick(base.getMediaWindowSeconds(), override.getMediaWindowSeconds()),
                pick(base.getSafetyEventsBeforeMinutes(), override.getSafetyEventsBeforeMinutes()),
                pick(base.getSafetyEventsAfterMinutes(), override.getSafetyEventsAfterMinutes()),
                pick(base.getVehicleStatsBeforeMinutes(), override.getVehicleStatsBeforeMinutes()),
                pick(base.getVehicleStatsAfterMinutes(), override.getVehicleStatsAfterMinutes()),
                pick(base.getCameraMediaWindowMinutes(), override.getCameraMediaWindowMinutes()));
    }

    private static CompanyConfig.Monitoring mergeMonitoring(CompanyConfig.Monitoring base,
                                                            CompanyConfig.Monitoring override) {
        if (base == null || override == null) return pick(base, override);
        return new CompanyConfig.Monitoring(
                pick(base.getConfidenceThreshold(), override.getConfidenceThreshold()),
                pick(base.getCheckIntervals(), override.getCheckIntervals()),
                pick(base.getMaxRevalidations(), override.getMaxRevalidations()));
    }

    private static CompanyConfig.UsageLimits mergeUsageLimits(CompanyConfig.UsageLimits base,
                                                              CompanyConfig.UsageLimits override) {
        if (base == null || override == null) return pick(base, override);
        return new CompanyConfig.UsageLimits(
                pick(base.getMaxRevalidationsPerEvent(), override.getMaxRevalidationsPerEvent()));
    }

    private static CompanyConfig.EscalationRoute mergeRoute(CompanyConfig.EscalationRoute base,
                                                            CompanyConfig.EscalationRoute override) {
        return new CompanyConfig.EscalationRoute(
                pick(base.getChannels(), override.getChannels()),
                pick(base.getRecipients(), override.getRecipients()));
    }

    private static CompanyConfig.EscalationPolicy mergePolicy(CompanyConfig.EscalationPolicy base,
                                                              CompanyConfig.EscalationPolicy override) {
        if (base == null || override == null) return pick(base, override);
        return new CompanyConfig.EscalationPolicy(
                pick(base.getIntervalMinutes(), override.getIntervalMinutes()),
                pick(base.getMaxEscalations(), override.getMaxEscalations()));
    }

    private static CompanyConfig.SlaPolicy mergeSla(CompanyConfig.SlaPolicy base,
                                                    CompanyConfig.SlaPolicy override) {
        return new CompanyConfig.SlaPolicy(
                pick(base.getAckMinutes(), override.getAckMinutes()),
                pick(base.getResolveMinutes(), override.getResolveMinutes()));
    }

    /**
     * An override that only carries the legacy {@code labels} list drops the
     * inherited rules so the labels take effect.
     */
    private static CompanyConfig.SafetyStreamNotify mergeNotify(CompanyConfig.SafetyStreamNotify base,
                                                                CompanyConfig.SafetyStreamNotify override) {
        if (base == null || override == null) return pick(base, override);
        boolean legacyOnly = override.getRules() == null && override.getLabels() != null;
        return new CompanyConfig.SafetyStreamNotify(
                pick(base.getEnabled(), override.getEnabled()),
                legacyOnly ? null : pick(base.getRules(), override.getRules()),
                pick(base.getLabels(), override.getLabels()));
    }

    private static CompanyConfig.StaleVehicleMonitor mergeStale(CompanyConfig.StaleVehicleMonitor base,
                                                                CompanyConfig.StaleVehicleMonitor override) {
        if (base == null || override == null) return pick(base, override);
        return new CompanyConfig.StaleVehicleMonitor(
                pick(base.getEnabled(), override.getEnabled()),
                pick(base.getThresholdMinutes(), override.getThresholdMinutes()),
                pick(base.getChannels(), override.getChannels()),
                pick(base.getRecipients(), override.getRecipients()));
    }

    private static CompanyConfig.Incidents mergeIncidents(CompanyConfig.Incidents base,
                                                          CompanyConfig.Incidents override) {
        if (base == null || override == null) return pick(base, override);
        return new CompanyConfig.Incidents(
                pick(base.getDedupeWindowMinutes(), override.getDedupeWindowMinutes()),
                pick(base.getSignalSearchWindowMinutes(), override.getSignalSearchWindowMinutes()));
    }

    private static CompanyConfig.Attention mergeAttention(CompanyConfig.Attention base,
                                                          CompanyConfig.Attention override) {
        if (base == null || override == null) return pick(base, override);
        return new CompanyConfig.Attention(pick(base.getEnabled(), override.getEnabled()));
    }

    private static ContactPoint mergeContact(ContactPoint base, ContactPoint override) {
        return new ContactPoint(
                pick(base.getName(), override.getName()),
                pick(base.getPhone(), override.getPhone()),
                pick(base.getWhatsapp(), override.getWhatsapp()),
                pick(base.getPriority(), override.getPriority()));
    }
}
