package com.example.fleetsafety.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CompanyConfigMergerTest {

    @Test
    void emptyOverride_keepsEveryDefault() {
        CompanyConfig merged = CompanyConfigMerger.merge(CompanyConfig.builtIn(), new CompanyConfig());

        assertThat(merged.getUsageLimits().getMaxRevalidationsPerEvent()).isEqualTo(3);
        assertThat(merged.getMonitoring().getCheckIntervals()).containsExactly(5, 15, 30, 60);
        assertThat(merged.getEscalationPolicy().getIntervalMinutes()).isEqualTo(10);
        assertThat(merged.getEscalationMatrix()).containsKeys("monitor", "warn", "call", "emergency");
        assertThat(merged.getSlaPolicies().get("critical").getAckMinutes()).isEqualTo(5);
        assertThat(merged.getAttention().getEnabled()).isTrue();
    }

    @Test
    void scalarOverride_replacesOnlyThatField() {
        CompanyConfig override = CompanyConfig.builder()
                .escalationPolicy(CompanyConfig.EscalationPolicy.builder().maxEscalations(5).build())
                .build();

        CompanyConfig merged = CompanyConfigMerger.merge(CompanyConfig.builtIn(), override);

        assertThat(merged.getEscalationPolicy().getMaxEscalations()).isEqualTo(5);
        assertThat(merged.getEscalationPolicy().getIntervalMinutes()).isEqualTo(10);
    }

    @Test
    void mapOverride_mergesPerKeyAndPerField() {
        CompanyConfig override = CompanyConfig.builder()
                .escalationMatrix(Map.of("warn", CompanyConfig.EscalationRoute.builder()
                        .channels(List.of("call")).build()))
                .slaPolicies(Map.of("critical", CompanyConfig.SlaPolicy.builder().ackMinutes(2).build()))
                .build();

        CompanyConfig merged = CompanyConfigMerger.merge(CompanyConfig.builtIn(), override);

        CompanyConfig.EscalationRoute warn = merged.getEscalationMatrix().get("warn");
        assertThat(warn.getChannels()).containsExactly("call");
        assertThat(warn.getRecipients()).containsExactly("monitoring_team");
        assertThat(merged.getEscalationMatrix().get("emergency").getRecipients())
                .containsExactly("monitoring_team", "supervisor", "emergency");

        CompanyConfig.SlaPolicy critical = merged.getSlaPolicies().get("critical");
        assertThat(critical.getAckMinutes()).isEqualTo(2);
        assertThat(critical.getResolveMinutes()).isEqualTo(60);
        assertThat(merged.getSlaPolicies()).containsKeys("warning", "info");
    }

    @Test
    void listOverride_replacesWholesale() {
        CompanyConfig override = CompanyConfig.builder()
                .monitoring(CompanyConfig.Monitoring.builder().checkIntervals(List.of(10)).build())
                .build();

        CompanyConfig merged = CompanyConfigMerger.merge(CompanyConfig.builtIn(), override);

        assertThat(merged.getMonitoring().getCheckIntervals()).containsExactly(10);
        assertThat(merged.getMonitoring().getConfidenceThreshold()).isEqualTo(0.80);
    }

    @Test
    void legacyLabels_dropInheritedRules() {
        CompanyConfig base = CompanyConfig.builtIn();
        base.setSafetyStreamNotify(new CompanyConfig.SafetyStreamNotify(true,
                List.of(DetectionRule.builder().id("crash").conditions(List.of("Crash")).build()), null));
        CompanyConfig override = CompanyConfig.builder()
                .safetyStreamNotify(CompanyConfig.SafetyStreamNotify.builder().labels(List.of("Drowsy")).build())
                .build();

        CompanyConfig merged = CompanyConfigMerger.merge(base, override);

        assertThat(merged.getSafetyStreamNotify().effectiveRules())
                .extracting(DetectionRule::getId)
                .containsExactly("migrated-drowsy");
        assertThat(merged.getSafetyStreamNotify().isActive()).isTrue();
    }

    @Test
    void rulesOverride_keepsInheritedEnabledFlag() {
        CompanyConfig base = CompanyConfig.builtIn();
        base.getSafetyStreamNotify().setEnabled(false);
        CompanyConfig override = CompanyConfig.builder()
                .safetyStreamNotify(CompanyConfig.SafetyStreamNotify.builder()
                        .rules(List.of(DetectionRule.builder().id("r").conditions(List.of("Crash")).build()))
                        .build())
                .build();

        CompanyConfig merged = CompanyConfigMerger.merge(base, override);

        assertThat(merged.getSafetyStreamNotify().isActive()).isFalse();
        assertThat(merged.getSafetyStreamNotify().effectiveRules()).hasSize(1);
    }

    @Test
    void nextCheckMinutes_clampsToLastInterval() {
        CompanyConfig.Monitoring monitoring = CompanyConfig.builtIn().getMonitoring();

        assertThat(monitoring.nextCheckMinutes(0)).isEqualTo(5);
        assertThat(monitoring.nextCheckMinutes(2)).isEqualTo(30);
        assertThat(monitoring.nextCheckMinutes(9)).isEqualTo(60);
        assertThat(new CompanyConfig.Monitoring(null, List.of(), null).nextCheckMinutes(1)).isEqualTo(15);
    }

    @Test
    void passThroughSections_mergeFieldByField() {
        CompanyConfig override = CompanyConfig.builder()
                .monitoring(CompanyConfig.Monitoring.builder().confidenceThreshold(0.95).build())
                .staleVehicleMonitor(CompanyConfig.StaleVehicleMonitor.builder().thresholdMinutes(45).build())
                .investigationWindows(CompanyConfig.InvestigationWindows.builder().mediaWindowSeconds(240).build())
                .build();

        CompanyConfig merged = CompanyConfigMerger.merge(CompanyConfig.builtIn(), override);

        assertThat(merged.getMonitoring().getConfidenceThreshold()).isEqualTo(0.95);
        assertThat(merged.getMonitoring().getMaxRevalidations()).isEqualTo(3);
        assertThat(merged.getMonitoring().getCheckIntervals()).containsExactly(5, 15, 30, 60);
        assertThat(merged.getStaleVehicleMonitor().getThresholdMinutes()).isEqualTo(45);
        assertThat(merged.getStaleVehicleMonitor().getEnabled()).isFalse();
        assertThat(merged.getStaleVehicleMonitor().getChannels()).containsExactly("whatsapp");
        assertThat(merged.getInvestigationWindows().getMediaWindowSeconds()).isEqualTo(240);
        assertThat(merged.getInvestigationWindows().getCorrelationWindowMinutes()).isEqualTo(20);
    }
}
