package com.example.fleetsafety.attention;

import com.example.fleetsafety.config.CompanyConfig;
import com.example.fleetsafety.config.CompanyConfigResolver;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.AlertActivity;
import com.example.fleetsafety.domain.NotificationDecision;
import com.example.fleetsafety.event.AlertEscalatedEvent;
import com.example.fleetsafety.notification.NotificationDecisionService;
import com.example.fleetsafety.repository.AlertRepository;
import com.example.fleetsafety.service.AlertActivityService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Attention engine - tracks acknowledgement and resolution SLAs for alerts
 * that need a human, and escalates unacknowledged ones through the company's
 * escalation matrix at a fixed interval.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttentionService {

    static final int MAX_ESCALATION_LEVEL = 2;
    private static final CompanyConfig.SlaPolicy DEFAULT_SLA = new CompanyConfig.SlaPolicy(60, 1440);

    private final AlertRepository alertRepository;
    private final CompanyConfigResolver configResolver;
    private final NotificationDecisionService decisionService;
    private final AlertActivityService activityService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Starts the SLA clocks. Skipped when attention is disabled for the
     * company, the alert already has an attention state, or it does not
     * warrant attention.
     *
     * @return true when attention was initialized
     */
    @Transactional
    public boolean initializeAttention(String alertId) {
        Alert alert = lock(alertId);
        CompanyConfig config = configResolver.resolve(alert.getCompanyId());

        if (!Boolean.TRUE.equals(config.getAttention().getEnabled())) return false;
        if (alert.getAttentionState() != null) return false;
        if (!alert.warrantsAttention()) return false;

        CompanyConfig.SlaPolicy sla = slaFor(config, alert);
        Instant now = clock.instant();
        alert.setAttentionState(Alert.AttentionState.NEEDS_ATTENTION);
        alert.setAckStatus(Alert.AckStatus.PENDING);
        alert.setAckDueAt(now.plus(Duration.ofMinutes(sla.getAckMinutes())));
        alert.setResolveDueAt(now.plus(Duration.ofMinutes(sla.getResolveMinutes())));
        alert.setNextEscalationAt(now.plus(Duration.ofMinutes(intervalMinutes(config))));
        alert.setEscalationLevel(0);
        alert.setEscalationCount(0);
        alertRepository.save(alert);

        log.info("Attention initialized for alert {} (severity={}, ack in {} min, resolve in {} min)",
                alertId, alert.getSeverity().value(), sla.getAckMinutes(), sla.getResolveMinutes());
        return true;
    }

    /** Idempotent: a second acknowledgement changes nothing. */
    @Transactional
    public Alert acknowledge(String alertId, Long userId) {
        Alert alert = lock(alertId);
        if (alert.getAckStatus() == Alert.AckStatus.ACKED) {
            return alert;
        }

        alert.setAckStatus(Alert.AckStatus.ACKED);
        alert.setAckedAt(clock.instant());
        alert.setAckedById(userId);
        alert.setAttentionState(Alert.AttentionState.IN_PROGRESS);
        alert.setNextEscalationAt(null);
        Alert saved = alertRepository.save(alert);

        activityService.logHumanAction(saved, userId, AlertActivity.Action.ATTENTION_ACKED, null);
        log.info("Alert {} acknowledged by user {}", alertId, userId);
        return saved;
    }

    /** Owner is a user or a contact, never both. */
    @Transactional
    public Alert assignOwner(String alertId, Long userId, Long contactId, Long assignedBy) {
        if ((userId == null) == (contactId == null)) {
            throw new IllegalArgumentException("Exactly one of userId or contactId must be given");
        }
        Alert alert = lock(alertId);
        alert.setOwnerUserId(userId);
        alert.setOwnerContactId(contactId);
        Alert saved = alertRepository.save(alert);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("owner_user_id", userId);
        metadata.put("owner_contact_id", contactId);
        activityService.logHumanAction(saved, assignedBy, AlertActivity.Action.ATTENTION_ASSIGNED, metadata);
        return saved;
    }

    /**
     * One escalation step. Raises the level (capped at 2), schedules the next
     * step and records a decision for the matrix row of the new level. Once
     * the company's maximum is reached no further steps are scheduled.
     *
     * @return the recorded decision, or null when the alert was not escalated
     */
    @Transactional
    public NotificationDecision escalate(String alertId) {
        Alert alert = lock(alertId);
        if (alert.getAttentionState() != Alert.AttentionState.NEEDS_ATTENTION
                || alert.getAckStatus() != Alert.AckStatus.PENDING) {
            log.debug("Alert {} no longer awaiting acknowledgement, escalation skipped", alertId);
            return null;
        }

        CompanyConfig config = configResolver.resolve(alert.getCompanyId());
        int maxEscalations = config.getEscalationPolicy().getMaxEscalations();
        if (alert.getEscalationCount() >= maxEscalations) {
            alert.setNextEscalationAt(null);
            alertRepository.save(alert);
            log.info("Alert {} reached max escalations ({})", alertId, maxEscalations);
            return null;
        }

        int level = Math.min(alert.getEscalationLevel() + 1, MAX_ESCALATION_LEVEL);
        int count = alert.getEscalationCount() + 1;
        alert.setEscalationLevel(level);
        alert.setEscalationCount(count);
        alert.setNextEscalationAt(clock.instant().plus(Duration.ofMinutes(intervalMinutes(config))));
        alertRepository.save(alert);

        Alert.RiskEscalation matrixKey = alert.escalationMatrixKey();
        String message = alert.getAiMessage() != null
                ? alert.getAiMessage() : "Alert requires attention - automatic escalation";
        NotificationDecision decision = decisionService.decideForAlert(alert, config, matrixKey,
                NotificationDecision.EscalationLevel.forMatrixKey(matrixKey), message,
                String.format("Automatic escalation (level %d/%d): not acknowledged within SLA", count, maxEscalations),
                "escalation-" + alertId + "-" + count, null);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("escalation_level", level);
        metadata.put("escalation_count", count);
        metadata.put("matrix_key", matrixKey.value());
        metadata.put("decision_id", decision.getId());
        activityService.logSystemAction(alert, AlertActivity.Action.ATTENTION_ESCALATED, metadata);

        meterRegistry.counter("fleet_safety.attention.escalations").increment();
        eventPublisher.publishEvent(new AlertEscalatedEvent(alertId, alert.getCompanyId(), level, count, decision.getId()));
        log.warn("Escalated alert {} to level {} ({}), escalation {}/{}",
                alertId, level, matrixKey.value(), count, maxEscalations);
        return decision;
    }

    /** Idempotent: closing a closed alert changes nothing. */
    @Transactional
    public Alert closeAttention(String alertId, Long userId, String reason) {
        Alert alert = lock(alertId);
        if (alert.getAttentionState() == Alert.AttentionState.CLOSED) {
            return alert;
        }

        alert.setAttentionState(Alert.AttentionState.CLOSED);
        alert.setResolvedAt(clock.instant());
        alert.setResolvedById(userId);
        alert.setResolutionReason(reason);
        alert.setNextEscalationAt(null);
        Alert saved = alertRepository.save(alert);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("reason", reason);
        activityService.logHumanAction(saved, userId, AlertActivity.Action.ATTENTION_CLOSED, metadata);
        log.info("Attention closed for alert {} by user {}", alertId, userId);
        return saved;
    }

    private Alert lock(String alertId) {
        return alertRepository.findByIdForUpdate(alertId)
                .orElseThrow(() -> new IllegalArgumentException("Alert not found: " + alertId));
    }

    private static CompanyConfig.SlaPolicy slaFor(CompanyConfig config, Alert alert) {
        Map<String, CompanyConfig.SlaPolicy> policies = config.getSlaPolicies();
        CompanyConfig.SlaPolicy policy = policies != null ? policies.get(alert.getSeverity().value()) : null;
        if (policy == null) return DEFAULT_SLA;
        return new CompanyConfig.SlaPolicy(
                policy.getAckMinutes() != null ? policy.getAckMinutes() : DEFAULT_SLA.getAckMinutes(),
                policy.getResolveMinutes() != null ? policy.getResolveMinutes() : DEFAULT_SLA.getResolveMinutes());
    }

    private static int intervalMinutes(CompanyConfig config) {
        Integer interval = config.getEscalationPolicy().getIntervalMinutes();
        return interval != null && interval > 0 ? interval : 10;
    }
}
