package com.example.fleetsafety.service;

import com.example.fleetsafety.config.CompanyConfig;
import com.example.fleetsafety.config.CompanyConfigResolver;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.AlertActivity;
import com.example.fleetsafety.domain.AlertAi;
import com.example.fleetsafety.domain.IllegalAlertTransitionException;
import com.example.fleetsafety.domain.InvestigationRecord;
import com.example.fleetsafety.repository.AlertRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * AI status state machine for alerts.
 *
 * Every transition loads the alert under a row lock, so the read-modify-write
 * of {@code aiStatus}, {@code investigationCount} and the investigation
 * history is atomic per alert. Transitions out of a terminal status are
 * rejected with {@link IllegalAlertTransitionException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertLifecycleService {

    public static final int DEFAULT_MAX_INVESTIGATIONS = 3;
    static final String MANUAL_REVIEW_MESSAGE =
            "Automatic investigation limit reached. Manual review is required to close this alert.";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final AlertRepository alertRepository;
    private final CompanyConfigResolver configResolver;
    private final AlertActivityService activityService;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /** Revalidation budget per alert; 3 when the company does not set one. */
    public static int getMaxInvestigations(CompanyConfig config) {
        if (config == null || config.getUsageLimits() == null
                || config.getUsageLimits().getMaxRevalidationsPerEvent() == null) {
            return DEFAULT_MAX_INVESTIGATIONS;
        }
        return config.getUsageLimits().getMaxRevalidationsPerEvent();
    }

    @Transactional
    public Alert markAsProcessing(String alertId) {
        Alert alert = lock(alertId);
        transition(alert, Alert.AiStatus.PROCESSING);
        return alertRepository.save(alert);
    }

    @Transactional
    public Alert markAsCompleted(String alertId, AiAssessment assessment, String humanMessage) {
        return markAsCompleted(alertId, assessment, humanMessage, null, null, null);
    }

    @Transactional
    public Alert markAsCompleted(String alertId, AiAssessment assessment, String humanMessage,
                                 Map<String, Object> alertContext, Map<String, Object> execution,
                                 Map<String, Object> notificationDecision) {
        Alert alert = lock(alertId);
        complete(alert, assessment, humanMessage, alertContext, execution, notificationDecision);
        return alertRepository.save(alert);
    }

    /**
     * Completes an alert that never went through triage (immediate-notify
     * rules). No assessment is stored.
     */
    @Transactional
    public Alert completeWithoutTriage(String alertId, String humanMessage) {
        Alert alert = lock(alertId);
        transition(alert, Alert.AiStatus.COMPLETED);
        alert.setAiMessage(humanMessage);
        return alertRepository.save(alert);
    }

    @Transactional
    public Alert markAsInvestigating(String alertId, AiAssessment assessment, String humanMessage,
                                     Integer nextCheckMinutes) {
        return markAsInvestigating(alertId, assessment, humanMessage, nextCheckMinutes, null, null, null);
    }

    /**
     * Enters (or stays in) investigating and counts one more investigation.
     * A null {@code nextCheckMinutes} picks the adaptive interval for the
     * current investigation count. When the company's budget is already spent
     * the alert is completed with the manual-review fallback instead.
     */
    @Transactional
    public Alert markAsInvestigating(String alertId, AiAssessment assessment, String humanMessage,
                                     Integer nextCheckMinutes, Map<String, Object> alertContext,
                                     Map<String, Object> execution, Map<String, Object> notificationDecision) {
        Alert alert = lock(alertId);
        CompanyConfig config = configResolver.resolve(alert.getCompanyId());
        int max = getMaxInvestigations(config);
        AlertAi ai = alert.getAi();
        int current = ai != null ? ai.getInvestigationCount() : 0;
        if (current >= max) {
            log.warn("Alert {} reached {} investigations, completing for manual review", alertId, max);
            complete(alert, AiAssessment.manualReviewFallback(), MANUAL_REVIEW_MESSAGE, alertContext, execution, null);
            return alertRepository.save(alert);
        }

        transition(alert, Alert.AiStatus.INVESTIGATING);
        alert.setAiMessage(humanMessage);
        applyAssessmentFields(alert, assessment, alertContext);
        storeNotificationPayload(alert, execution, notificationDecision);

        ai = syncAiData(alert, assessment, alertContext);
        int nextCheck = nextCheckMinutes != null
                ? nextCheckMinutes
                : config.getMonitoring().nextCheckMinutes(ai.getInvestigationCount());
        ai.setInvestigationCount(ai.getInvestigationCount() + 1);
        ai.setNextCheckMinutes(nextCheck);
        ai.setLastInvestigationAt(clock.instant());

        log.info("Alert {} investigating (#{} of {}, next check in {} min)",
                alertId, ai.getInvestigationCount(), max, nextCheck);
        return alertRepository.save(alert);
    }

    /** Completes with the manual-review fallback once the investigation budget is spent. */
    @Transactional
    public Alert completeAfterMaxInvestigations(String alertId) {
        Alert alert = lock(alertId);
        complete(alert, AiAssessment.manualReviewFallback(), MANUAL_REVIEW_MESSAGE, null, null, null);
        return alertRepository.save(alert);
    }

    /** Creates the AI record if needed so the error is never lost. */
    @Transactional
    public Alert markAsFailed(String alertId, String errorMessage) {
        Alert alert = lock(alertId);
        transition(alert, Alert.AiStatus.FAILED);
        AlertAi ai = alert.getAi();
        if (ai == null) {
            ai = AlertAi.builder().build();
            alert.attachAi(ai);
        }
        ai.setAiError(errorMessage != null ? errorMessage : "unknown error");
        log.warn("Alert {} failed: {}", alertId, errorMessage);
        return alertRepository.save(alert);
    }

    /**
     * Records the outcome of the current investigation. Amends the last history
     * entry when it belongs to the current investigation number, otherwise
     * appends a new one. Does nothing when the alert has no AI record.
     */
    @Transactional
    public Alert addInvestigationRecord(String alertId, String reason) {
        Alert alert = lock(alertId);
        AlertAi ai = alert.getAi();
        if (ai == null) {
            log.debug("Alert {} has no AI record, investigation note skipped", alertId);
            return alert;
        }

        Instant now = clock.instant();
        List<InvestigationRecord> history = ai.getInvestigationHistory() != null
                ? new ArrayList<>(ai.getInvestigationHistory())
                : new ArrayList<>();
        InvestigationRecord last = ai.lastInvestigationRecord();

        if (last != null && last.getInvestigationNumber() == ai.getInvestigationCount()) {
            history.set(history.size() - 1, last.toBuilder()
                    .aiReason(reason)
                    .aiEvaluatedAt(now)
                    .build());
        } else {
            history.add(InvestigationRecord.builder()
                    .investigationNumber(ai.getInvestigationCount())
                    .timestamp(now)
                    .reason(reason)
                    .build());
        }
        ai.setInvestigationHistory(history);
        return alertRepository.save(alert);
    }

    @Transactional(readOnly = true)
    public boolean shouldRevalidate(String alertId) {
        return find(alertId).shouldRevalidate(clock.instant());
    }

    @Transactional(readOnly = true)
    public Alert find(String alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new IllegalArgumentException("Alert not found: " + alertId));
    }

    private Alert lock(String alertId) {
        return alertRepository.findByIdForUpdate(alertId)
                .orElseThrow(() -> new IllegalArgumentException("Alert not found: " + alertId));
    }

    private void complete(Alert alert, AiAssessment assessment, String humanMessage,
                          Map<String, Object> alertContext, Map<String, Object> execution,
                          Map<String, Object> notificationDecision) {
        transition(alert, Alert.AiStatus.COMPLETED);
        alert.setAiMessage(humanMessage);
        applyAssessmentFields(alert, assessment, alertContext);
        storeNotificationPayload(alert, execution, notificationDecision);
        syncAiData(alert, assessment, alertContext);
        log.info("Alert {} completed (verdict={}, risk={})", alert.getId(),
                alert.getVerdict() != null ? alert.getVerdict().value() : null,
                alert.getRiskEscalation() != null ? alert.getRiskEscalation().value() : null);
    }

    private void transition(Alert alert, Alert.AiStatus target) {
        Alert.AiStatus from = alert.getAiStatus();
        if (!from.canTransitionTo(target)) {
            throw new IllegalAlertTransitionException(alert.getId(), from, target);
        }
        alert.setAiStatus(target);
        if (from != target) {
            activityService.logAiAction(alert, AlertActivity.Action.AI_STATUS_CHANGED,
                    Map.of("old_status", from.value(), "new_status", target.value()));
        }
        Counter.builder("fleet_safety.alert.transitions")
                .tag("status", target.value())
                .register(meterRegistry)
                .increment();
    }

    private void applyAssessmentFields(Alert alert, AiAssessment assessment, Map<String, Object> alertContext) {
        if (assessment != null) {
            if (assessment.getVerdict() != null) alert.setVerdict(assessment.getVerdict());
            if (assessment.getLikelihood() != null) alert.setLikelihood(assessment.getLikelihood());
            if (assessment.getConfidence() != null) alert.setConfidence(assessment.getConfidence());
            if (assessment.getReasoning() != null) alert.setReasoning(assessment.getReasoning());
            if (assessment.getRiskEscalation() != null) alert.setRiskEscalation(assessment.getRiskEscalation());
            if (assessment.getDedupeKey() != null) alert.setDedupeKey(assessment.getDedupeKey());
        }
        if (alertContext != null) {
            if (alertContext.containsKey("proactive_flag")) {
                alert.setProactiveFlag(Boolean.TRUE.equals(alertContext.get("proactive_flag")));
            }
            Object kind = alertContext.get("alert_kind");
            if (kind instanceof String value && Alert.AlertKind.fromValue(value) != null) {
                alert.setAlertKind(Alert.AlertKind.fromValue(value));
            }
        }
    }

    private void storeNotificationPayload(Alert alert, Map<String, Object> execution,
                                          Map<String, Object> notificationDecision) {
        if (notificationDecision != null) alert.setNotificationDecisionPayload(notificationDecision);
        if (execution != null) alert.setNotificationExecution(execution);
    }

    private AlertAi syncAiData(Alert alert, AiAssessment assessment, Map<String, Object> alertContext) {
        AlertAi ai = alert.getAi();
        if (ai == null) {
            ai = AlertAi.builder().build();
            alert.attachAi(ai);
        }
        if (assessment != null) {
            ai.setAiAssessment(objectMapper.convertValue(assessment, MAP_TYPE));
            if (assessment.getMonitoringReason() != null) {
                ai.setMonitoringReason(assessment.getMonitoringReason());
            }
        }
        if (alertContext != null) {
            ai.setAlertContext(alertContext);
        }
        return ai;
    }
}
