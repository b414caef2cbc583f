package com.example.fleetsafety.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * What was decided for one alert at one point in time. Decisions are never
 * updated: a new decision is a new row, so the table is the escalation audit
 * trail. Build through {@code NotificationDecisionService.createWithRecipients}.
 */
@Entity
@Immutable
@Table(name = "notification_decisions", indexes = {
        @Index(name = "idx_decision_alert", columnList = "alert_id, created_at")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_decision_alert_sequence", columnNames = {"alert_id", "sequence_number"})
})
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationDecision {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "alert_id", nullable = false, updatable = false)
    private String alertId;

    /** 1-based position among the decisions of the same alert. */
    @Column(name = "sequence_number", nullable = false, updatable = false)
    private int sequence;

    @Column(name = "should_notify", nullable = false, updatable = false)
    private boolean shouldNotify;

    @Enumerated(EnumType.STRING)
    @Column(name = "escalation_level", nullable = false, updatable = false)
    private EscalationLevel escalationLevel;

    @Column(name = "message_text", length = 4096, updatable = false)
    private String messageText;

    @Column(name = "call_script", length = 4096, updatable = false)
    private String callScript;

    @Column(length = 2048, updatable = false)
    private String reason;

    @Column(name = "dedupe_key", updatable = false)
    private String dedupeKey;

    @ElementCollection
    @CollectionTable(name = "notification_decision_channels", joinColumns = @JoinColumn(name = "decision_id"))
    @OrderColumn(name = "position")
    @Column(name = "channel")
    private List<String> channels = new ArrayList<>();

    @OneToMany(mappedBy = "decision", cascade = CascadeType.ALL)
    @OrderBy("priority ASC, position ASC")
    @ToString.Exclude
    private List<NotificationRecipient> recipients = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Builder
    private NotificationDecision(String alertId, int sequence, boolean shouldNotify, EscalationLevel escalationLevel,
                                 String messageText, String callScript, String reason, String dedupeKey,
                                 List<String> channels, List<NotificationRecipient> recipients,
                                 Instant createdAt) {
        this.alertId = alertId;
        this.sequence = sequence;
        this.shouldNotify = shouldNotify;
        this.escalationLevel = escalationLevel != null ? escalationLevel : EscalationLevel.NONE;
        this.messageText = messageText;
        this.callScript = callScript;
        this.reason = reason;
        this.dedupeKey = dedupeKey;
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
        this.createdAt = createdAt;
        if (recipients != null) {
            for (NotificationRecipient recipient : recipients) {
                recipient.bindTo(this);
                this.recipients.add(recipient);
            }
        }
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public List<NotificationRecipient> getRecipients() {
        return Collections.unmodifiableList(recipients);
    }

    public List<String> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public enum EscalationLevel {
        EMERGENCY, CRITICAL, HIGH, LOW, NONE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Canonical values pass through (trimmed, case-insensitive); null or
         * blank means none; anything unrecognized escalates to critical.
         */
        @JsonCreator
        public static EscalationLevel normalize(String raw) {
            if (raw == null || raw.isBlank()) return NONE;
            return switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "emergency" -> EMERGENCY;
                case "critical" -> CRITICAL;
                case "high" -> HIGH;
                case "low" -> LOW;
                case "none" -> NONE;
                default -> CRITICAL;
            };
        }

        /** Decision level for an escalation matrix row. */
        public static EscalationLevel forMatrixKey(Alert.RiskEscalation key) {
            if (key == null) return NONE;
            return switch (key) {
                case EMERGENCY -> EMERGENCY;
                case CALL -> HIGH;
                case WARN -> LOW;
                case MONITOR -> NONE;
            };
        }
    }
}
