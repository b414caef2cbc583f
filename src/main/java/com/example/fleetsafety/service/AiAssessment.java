package com.example.fleetsafety.service;

import com.example.fleetsafety.domain.Alert;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assessment payload returned by the AI pipeline. Fields the engine does not
 * interpret are kept in {@code additional} so the raw payload survives a
 * round trip into {@code AlertAi.aiAssessment}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AiAssessment {

    private Alert.Verdict verdict;
    private Alert.Likelihood likelihood;
    private Double confidence;
    private String reasoning;
    private Alert.RiskEscalation riskEscalation;
    private String dedupeKey;
    private String monitoringReason;
    private Boolean requiresMonitoring;
    private Integer nextCheckMinutes;

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> additional = new LinkedHashMap<>();

    @JsonAnySetter
    public void putAdditional(String key, Object value) {
        additional.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> additionalProperties() {
        return additional;
    }

    public boolean monitoringRequested() {
        return Boolean.TRUE.equals(requiresMonitoring);
    }

    /** Fallback used when the revalidation budget is spent without a conclusion. */
    public static AiAssessment manualReviewFallback() {
        return AiAssessment.builder()
                .verdict(Alert.Verdict.NEEDS_REVIEW)
                .likelihood(Alert.Likelihood.MEDIUM)
                .confidence(0.5)
                .reasoning("Maximum number of investigations reached without a conclusive verdict.")
                .riskEscalation(Alert.RiskEscalation.WARN)
                .requiresMonitoring(false)
                .build();
    }
}
