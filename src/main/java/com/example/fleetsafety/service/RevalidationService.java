package com.example.fleetsafety.service;

import com.example.fleetsafety.attention.AttentionService;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.incident.IncidentService;
import com.example.fleetsafety.notification.NotificationDecisionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Applies AI pipeline results to an alert and drives the bounded
 * revalidation loop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RevalidationService {

    static final String DEFAULT_MONITORING_REASON = "Continued monitoring requested by triage";

    private final AlertLifecycleService lifecycleService;
    private final AttentionService attentionService;
    private final IncidentService incidentService;
    private final NotificationDecisionService decisionService;

    /**
     * Outcomes asking for monitoring move the alert to (or keep it in)
     * investigating and note the reason in its history; anything else
     * completes it. Follow-ups (attention, incident, AI decision record) run
     * in the same transaction.
     */
    @Transactional
    public Alert applyAssessment(String alertId, AssessmentOutcome outcome) {
        AiAssessment assessment = outcome.getAssessment();

        Alert alert;
        if (assessment != null && assessment.monitoringRequested()) {
            alert = lifecycleService.markAsInvestigating(alertId, assessment, outcome.getHumanMessage(),
                    assessment.getNextCheckMinutes(),
                    outcome.getAlertContext(), outcome.getExecution(), outcome.getNotificationDecision());
            if (alert.getAiStatus() == Alert.AiStatus.INVESTIGATING) {
                String reason = assessment.getMonitoringReason() != null
                        ? assessment.getMonitoringReason() : DEFAULT_MONITORING_REASON;
                alert = lifecycleService.addInvestigationRecord(alertId, reason);
            }
        } else {
            alert = lifecycleService.markAsCompleted(alertId, assessment, outcome.getHumanMessage(),
                    outcome.getAlertContext(), outcome.getExecution(), outcome.getNotificationDecision());
        }

        followUp(alert, assessment, outcome.getNotificationDecision());
        return alert;
    }

    /** Used by the sweeper when the investigation budget is already spent. */
    @Transactional
    public Alert completeAfterMaxInvestigations(String alertId) {
        Alert alert = lifecycleService.completeAfterMaxInvestigations(alertId);
        followUp(alert, AiAssessment.manualReviewFallback(), null);
        return alert;
    }

    private void followUp(Alert alert, AiAssessment assessment, Map<String, Object> notificationDecision) {
        if (notificationDecision != null && Boolean.TRUE.equals(notificationDecision.get("should_notify"))) {
            decisionService.recordFromPayload(alert.getId(), notificationDecision);
        }
        attentionService.initializeAttention(alert.getId());
        if (alert.getAiStatus() == Alert.AiStatus.COMPLETED && incidentService.shouldCreateIncident(alert, assessment)) {
            incidentService.createFromAlert(alert.getId(), assessment);
        }
    }
}
