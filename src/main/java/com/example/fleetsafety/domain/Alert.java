package com.example.fleetsafety.domain;

import com.example.fleetsafety.domain.convert.JsonMapConverter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * A possible safety or panic event undergoing AI triage.
 *
 * Carries two independent state machines: {@code aiStatus} (driven by the
 * triage pipeline through {@code AlertLifecycleService}) and
 * {@code humanStatus} (driven by reviewers). The attention fields track the
 * acknowledgement and resolution SLAs.
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_company_status", columnList = "company_id, ai_status"),
        @Index(name = "idx_alert_attention", columnList = "attention_state, ack_status, next_escalation_at"),
        @Index(name = "idx_alert_dedupe", columnList = "company_id, dedupe_key")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "company_id")
    private Long companyId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "signal_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Signal signal;

    @Column(name = "event_description")
    private String eventDescription;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Severity severity = Severity.INFO;

    @Column(name = "occurred_at")
    private Instant occurredAt;

    // AI triage

    @Enumerated(EnumType.STRING)
    @Column(name = "ai_status", nullable = false)
    @Builder.Default
    private AiStatus aiStatus = AiStatus.PENDING;

    @Column(name = "ai_message", length = 4096)
    private String aiMessage;

    @Enumerated(EnumType.STRING)
    private Verdict verdict;

    @Enumerated(EnumType.STRING)
    private Likelihood likelihood;

    private Double confidence;

    @Column(length = 8192)
    private String reasoning;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_escalation")
    private RiskEscalation riskEscalation;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_kind")
    private AlertKind alertKind;

    @Column(name = "dedupe_key")
    private String dedupeKey;

    @Column(name = "proactive_flag")
    @Builder.Default
    private boolean proactiveFlag = false;

    /** Last notification decision handed back by the AI pipeline, stored verbatim. */
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "notification_decision_payload", length = 16384)
    private Map<String, Object> notificationDecisionPayload;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "notification_execution", length = 16384)
    private Map<String, Object> notificationExecution;

    @OneToOne(mappedBy = "alert", cascade = CascadeType.ALL, orphanRemoval = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private AlertAi ai;

    // Human review

    @Enumerated(EnumType.STRING)
    @Column(name = "human_status", nullable = false)
    @Builder.Default
    private HumanStatus humanStatus = HumanStatus.PENDING;

    @Column(name = "reviewed_by_id")
    private Long reviewedById;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    // Attention

    @Enumerated(EnumType.STRING)
    @Column(name = "attention_state")
    private AttentionState attentionState;

    @Enumerated(EnumType.STRING)
    @Column(name = "ack_status")
    private AckStatus ackStatus;

    @Column(name = "ack_due_at")
    private Instant ackDueAt;

    @Column(name = "acked_at")
    private Instant ackedAt;

    @Column(name = "acked_by_id")
    private Long ackedById;

    @Column(name = "resolve_due_at")
    private Instant resolveDueAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by_id")
    private Long resolvedById;

    @Column(name = "resolution_reason", length = 2048)
    private String resolutionReason;

    @Column(name = "next_escalation_at")
    private Instant nextEscalationAt;

    @Column(name = "escalation_level")
    @Builder.Default
    private int escalationLevel = 0;

    @Column(name = "escalation_count")
    @Builder.Default
    private int escalationCount = 0;

    @Column(name = "owner_user_id")
    private Long ownerUserId;

    @Column(name = "owner_contact_id")
    private Long ownerContactId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void attachAi(AlertAi record) {
        record.setAlert(this);
        this.ai = record;
    }

    // =========================================================================
    // Derived state
    // =========================================================================

    /**
     * Explicit attention states win: closed is never flagged, needs_attention
     * always is. Human-reviewed alerts are never flagged otherwise.
     */
    public boolean needsAttention() {
        if (attentionState == AttentionState.CLOSED) return false;
        if (attentionState == AttentionState.NEEDS_ATTENTION) return true;
        if (humanStatus != HumanStatus.PENDING) return false;

        return aiStatus == AiStatus.FAILED
                || aiStatus == AiStatus.INVESTIGATING
                || severity == Severity.CRITICAL
                || requiresUrgentEscalation();
    }

    /** Derived from human and AI status only; attention state is not consulted. */
    public UrgencyLevel humanUrgencyLevel() {
        if (humanStatus != HumanStatus.PENDING) return UrgencyLevel.LOW;
        if (aiStatus == AiStatus.FAILED || severity == Severity.CRITICAL || requiresUrgentEscalation()) {
            return UrgencyLevel.HIGH;
        }
        if (aiStatus == AiStatus.INVESTIGATING) return UrgencyLevel.MEDIUM;
        return UrgencyLevel.LOW;
    }

    public boolean requiresUrgentEscalation() {
        return riskEscalation == RiskEscalation.CALL || riskEscalation == RiskEscalation.EMERGENCY;
    }

    public boolean warrantsAttention() {
        if (severity == Severity.CRITICAL) return true;
        if (riskEscalation != null && riskEscalation != RiskEscalation.MONITOR) return true;
        return hasHighRiskVerdict() || verdict == Verdict.NEEDS_REVIEW;
    }

    public boolean hasHighRiskVerdict() {
        return verdict == Verdict.REAL_PANIC
                || verdict == Verdict.CONFIRMED_VIOLATION
                || verdict == Verdict.RISK_DETECTED;
    }

    public boolean isProbableFalsePositive() {
        return verdict == Verdict.LIKELY_FALSE_POSITIVE || humanStatus == HumanStatus.FALSE_POSITIVE;
    }

    public boolean isProcessed() {
        return aiStatus.isTerminal();
    }

    public boolean isHumanReviewed() {
        return humanStatus != HumanStatus.PENDING;
    }

    public boolean hasOwner() {
        return ownerUserId != null || ownerContactId != null;
    }

    /** Eligibility for the next revalidation pass. Only investigating alerts qualify. */
    public boolean shouldRevalidate(Instant now) {
        if (aiStatus != AiStatus.INVESTIGATING) return false;
        if (ai == null || ai.getLastInvestigationAt() == null) return true;
        Integer next = ai.getNextCheckMinutes();
        if (next == null || next <= 0) return true;
        return Duration.between(ai.getLastInvestigationAt(), now).toMinutes() >= next;
    }

    public RiskEscalation escalationMatrixKey() {
        if (escalationLevel >= 2) return RiskEscalation.EMERGENCY;
        if (escalationLevel >= 1) return RiskEscalation.CALL;
        return RiskEscalation.WARN;
    }

    // SLA

    public Long ackSlaRemainingSeconds(Instant now) {
        if (ackDueAt == null || ackStatus == AckStatus.ACKED) return null;
        return Duration.between(now, ackDueAt).getSeconds();
    }

    public boolean isOverdueForAck(Instant now) {
        return ackStatus == AckStatus.PENDING && ackDueAt != null && now.isAfter(ackDueAt);
    }

    public Long resolveSlaRemainingSeconds(Instant now) {
        if (resolveDueAt == null || attentionState == AttentionState.CLOSED) return null;
        return Duration.between(now, resolveDueAt).getSeconds();
    }

    public boolean isOverdueForResolution(Instant now) {
        return attentionState != AttentionState.CLOSED && resolveDueAt != null && now.isAfter(resolveDueAt);
    }

    // =========================================================================
    // Enums
    // =========================================================================

    public enum AiStatus {
        PENDING, PROCESSING, INVESTIGATING, COMPLETED, FAILED;

        public boolean isTerminal() {
            return switch (this) {
                case COMPLETED, FAILED -> true;
                case PENDING, PROCESSING, INVESTIGATING -> false;
            };
        }

        public boolean canTransitionTo(AiStatus target) {
            return switch (this) {
                case PENDING -> target == PROCESSING || target == COMPLETED || target == FAILED;
                case PROCESSING -> target == INVESTIGATING || target == COMPLETED || target == FAILED;
                case INVESTIGATING -> target == INVESTIGATING || target == COMPLETED || target == FAILED;
                case COMPLETED, FAILED -> false;
            };
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum HumanStatus {
        PENDING, REVIEWED, FLAGGED, RESOLVED, FALSE_POSITIVE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /** Exact match only; case or whitespace variants are rejected. */
        @JsonCreator
        public static HumanStatus fromValue(String value) {
            if (value != null) {
                for (HumanStatus status : values()) {
                    if (status.value().equals(value)) {
                        return status;
                    }
                }
            }
            throw new IllegalArgumentException("Invalid human_status: " + value);
        }
    }

    public enum AttentionState {
        NEEDS_ATTENTION, IN_PROGRESS, BLOCKED, CLOSED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum AckStatus {
        PENDING, ACKED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Verdict {
        REAL_PANIC, CONFIRMED_VIOLATION, NEEDS_REVIEW, UNCERTAIN,
        LIKELY_FALSE_POSITIVE, NO_ACTION_NEEDED, RISK_DETECTED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /** Unknown verdicts from the pipeline are left unset. */
        @JsonCreator
        public static Verdict fromValue(String value) {
            return lookup(Verdict.class, value);
        }
    }

    public enum Likelihood {
        HIGH, MEDIUM, LOW;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Likelihood fromValue(String value) {
            return lookup(Likelihood.class, value);
        }
    }

    public enum RiskEscalation {
        MONITOR, WARN, CALL, EMERGENCY;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static RiskEscalation fromValue(String value) {
            return lookup(RiskEscalation.class, value);
        }
    }

    public enum AlertKind {
        PANIC, SAFETY, TAMPERING, CONNECTIVITY, UNKNOWN;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static AlertKind fromValue(String value) {
            return lookup(AlertKind.class, value);
        }
    }

    public enum UrgencyLevel {
        LOW, MEDIUM, HIGH;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private static <E extends Enum<E>> E lookup(Class<E> type, String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
