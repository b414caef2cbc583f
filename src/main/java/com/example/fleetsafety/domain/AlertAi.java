package com.example.fleetsafety.domain;

import com.example.fleetsafety.domain.convert.InvestigationHistoryConverter;
import com.example.fleetsafety.domain.convert.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Investigation state of an {@link Alert}: revalidation counters, the raw AI
 * assessment and the investigation history.
 */
@Entity
@Table(name = "alert_ai")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertAi {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "alert_id", nullable = false, unique = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Alert alert;

    @Column(name = "investigation_count")
    @Builder.Default
    private int investigationCount = 0;

    @Column(name = "last_investigation_at")
    private Instant lastInvestigationAt;

    @Column(name = "next_check_minutes")
    private Integer nextCheckMinutes;

    @Convert(converter = InvestigationHistoryConverter.class)
    @Column(name = "investigation_history", length = 65535)
    @Builder.Default
    private List<InvestigationRecord> investigationHistory = new ArrayList<>();

    @Column(name = "ai_error", length = 4096)
    private String aiError;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "ai_assessment", length = 65535)
    private Map<String, Object> aiAssessment;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "alert_context", length = 65535)
    private Map<String, Object> alertContext;

    @Column(name = "monitoring_reason", length = 4096)
    private String monitoringReason;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }

    public InvestigationRecord lastInvestigationRecord() {
        if (investigationHistory == null || investigationHistory.isEmpty()) return null;
        return investigationHistory.get(investigationHistory.size() - 1);
    }
}
