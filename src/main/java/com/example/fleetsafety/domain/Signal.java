package com.example.fleetsafety.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A safety event received from the telematics stream. Signals are upserted by
 * {@code (companyId, sourceEventId)}; the first label seen is the primary one.
 */
@Entity
@Table(name = "signals",
        uniqueConstraints = @UniqueConstraint(name = "uk_signal_source_event",
                columnNames = {"company_id", "source_event_id"}),
        indexes = {
                @Index(name = "idx_signal_vehicle_time", columnList = "company_id, vehicle_id, occurred_at"),
                @Index(name = "idx_signal_driver_time", columnList = "company_id, driver_id, occurred_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Signal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "company_id")
    private Long companyId;

    @Column(name = "source_event_id", nullable = false)
    private String sourceEventId;

    @Column(name = "primary_behavior_label")
    private String primaryBehaviorLabel;

    @ElementCollection
    @CollectionTable(name = "signal_behavior_labels", joinColumns = @JoinColumn(name = "signal_id"))
    @OrderColumn(name = "position")
    @Column(name = "label")
    @Builder.Default
    private List<String> behaviorLabels = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @Column(name = "event_state")
    private String eventState;

    @Column(name = "vehicle_id")
    private String vehicleId;

    @Column(name = "vehicle_name")
    private String vehicleName;

    @Column(name = "driver_id")
    private String driverId;

    @Column(name = "driver_name")
    private String driverName;

    @Column(name = "occurred_at")
    private Instant occurredAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = createdAt;
        if (severity == null) severity = Severity.INFO;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
