package com.example.fleetsafety.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.util.Locale;

/**
 * One recipient of a {@link NotificationDecision}. Lower priority is contacted
 * first; {@code position} keeps insertion order among equal priorities.
 */
@Entity
@Immutable
@Table(name = "notification_recipients", indexes = {
        @Index(name = "idx_recipient_decision", columnList = "decision_id")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NotificationRecipient {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "decision_id", nullable = false, updatable = false)
    @ToString.Exclude
    private NotificationDecision decision;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type", nullable = false, updatable = false)
    private RecipientType recipientType;

    @Column(updatable = false)
    private String name;

    @Column(updatable = false)
    private String phone;

    @Column(updatable = false)
    private String whatsapp;

    @Column(nullable = false, updatable = false)
    private int priority;

    @Column(nullable = false, updatable = false)
    private int position;

    void bindTo(NotificationDecision owner) {
        this.decision = owner;
    }

    /** Phone first, WhatsApp as fallback. */
    public String bestContactNumber() {
        if (phone != null && !phone.isBlank()) return phone;
        if (whatsapp != null && !whatsapp.isBlank()) return whatsapp;
        return null;
    }

    public boolean hasContactMethod() {
        return bestContactNumber() != null;
    }

    public enum RecipientType {
        OPERATOR, MONITORING_TEAM, SUPERVISOR, EMERGENCY, DISPATCH, OTHER;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /** Accepts the short form {@code monitoring}; unknown types map to other. */
        @JsonCreator
        public static RecipientType fromValue(String value) {
            if (value == null) return OTHER;
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "operator" -> OPERATOR;
                case "monitoring", "monitoring_team" -> MONITORING_TEAM;
                case "supervisor" -> SUPERVISOR;
                case "emergency" -> EMERGENCY;
                case "dispatch" -> DISPATCH;
                default -> OTHER;
            };
        }
    }
}
