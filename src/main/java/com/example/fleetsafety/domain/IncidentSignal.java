package com.example.fleetsafety.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "incident_signals", uniqueConstraints = @UniqueConstraint(
        name = "uk_incident_signal", columnNames = {"incident_id", "signal_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentSignal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "incident_id", nullable = false)
    private String incidentId;

    @Column(name = "signal_id", nullable = false)
    private String signalId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Incident.LinkRole role;

    @Column(name = "relevance_score")
    private Double relevanceScore;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
