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
 * A correlation of one or more signals and alerts believed to be the same
 * real-world event. Status only moves through {@link IncidentStatus#canTransitionTo}.
 */
@Entity
@Table(name = "incidents", indexes = {
        @Index(name = "idx_incident_company_status", columnList = "company_id, status"),
        @Index(name = "idx_incident_dedupe", columnList = "company_id, dedupe_key"),
        @Index(name = "idx_incident_source_event", columnList = "company_id, source_event_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "company_id")
    private Long companyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "incident_type", nullable = false)
    private IncidentType incidentType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Priority priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "subject_type")
    private SubjectType subjectType;

    @Column(name = "subject_id")
    private String subjectId;

    @Column(name = "subject_name")
    private String subjectName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Source source;

    @Column(name = "source_event_id")
    private String sourceEventId;

    @Column(name = "dedupe_key")
    private String dedupeKey;

    @Column(name = "ai_summary", length = 8192)
    private String aiSummary;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 8192)
    private Map<String, Object> metadata;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = createdAt;
        if (status == null) status = IncidentStatus.OPEN;
        if (detectedAt == null) detectedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isResolved() {
        return status.isTerminal();
    }

    /**
     * Moves to {@code target}, rejecting pairs outside the transition table.
     * Terminal targets stamp {@code resolvedAt}.
     */
    public void transitionTo(IncidentStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalIncidentTransitionException(id, status, target);
        }
        status = target;
        if (target.isTerminal()) {
            resolvedAt = now;
        }
    }

    /** A null summary keeps the existing one. */
    public void markAsResolved(String summary, Instant now) {
        transitionTo(IncidentStatus.RESOLVED, now);
        if (summary != null) aiSummary = summary;
    }

    public void markAsFalsePositive(String summary, Instant now) {
        transitionTo(IncidentStatus.FALSE_POSITIVE, now);
        if (summary != null) aiSummary = summary;
    }

    public enum IncidentType {
        COLLISION, EMERGENCY, PATTERN, SAFETY_VIOLATION, TAMPERING, UNKNOWN;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Priority {
        P1("Critical"), P2("High"), P3("Medium"), P4("Low");

        private final String label;

        Priority(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public enum IncidentStatus {
        OPEN, INVESTIGATING, PENDING_ACTION, RESOLVED, FALSE_POSITIVE;

        public boolean isTerminal() {
            return switch (this) {
                case RESOLVED, FALSE_POSITIVE -> true;
                case OPEN, INVESTIGATING, PENDING_ACTION -> false;
            };
        }

        public boolean canTransitionTo(IncidentStatus target) {
            return switch (this) {
                case OPEN -> target != OPEN;
                case INVESTIGATING -> target == PENDING_ACTION || target == RESOLVED || target == FALSE_POSITIVE;
                case PENDING_ACTION -> target == INVESTIGATING || target == RESOLVED || target == FALSE_POSITIVE;
                case RESOLVED, FALSE_POSITIVE -> false;
            };
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum SubjectType {
        DRIVER, VEHICLE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Source {
        ALERT, AUTO_PATTERN, AUTO_AGGREGATOR, MANUAL
    }

    /** Role of a signal or alert inside an incident. */
    public enum LinkRole {
        PRIMARY, SUPPORTING, CONTRADICTING, CONTEXT
    }
}
