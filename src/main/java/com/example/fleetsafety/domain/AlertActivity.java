package com.example.fleetsafety.domain;

import com.example.fleetsafety.domain.convert.JsonMapConverter;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Append-only activity trail for an alert. Records every review, attention
 * and escalation action taken by a human, the AI pipeline or the system.
 */
@Entity
@Table(name = "alert_activities", indexes = {
        @Index(name = "idx_activity_alert", columnList = "alert_id"),
        @Index(name = "idx_activity_action", columnList = "action"),
        @Index(name = "idx_activity_created", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertActivity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "alert_id", nullable = false)
    private String alertId;

    @Column(name = "company_id")
    private Long companyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_type", nullable = false)
    private ActorType actorType;

    /** Null for AI and system actions. */
    @Column(name = "user_id")
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Action action;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 8192)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public enum ActorType {
        HUMAN, AI, SYSTEM
    }

    public enum Action {
        HUMAN_STATUS_CHANGED,
        COMMENT_ADDED,
        AI_STATUS_CHANGED,
        ATTENTION_ACKED,
        ATTENTION_ASSIGNED,
        ATTENTION_ESCALATED,
        ATTENTION_CLOSED,
        INCIDENT_LINKED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
