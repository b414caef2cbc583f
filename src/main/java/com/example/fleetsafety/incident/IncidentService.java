package com.example.fleetsafety.incident;

import com.example.fleetsafety.config.CompanyConfig;
import com.example.fleetsafety.config.CompanyConfigResolver;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.AlertActivity;
import com.example.fleetsafety.domain.Incident;
import com.example.fleetsafety.domain.IncidentAlert;
import com.example.fleetsafety.domain.IncidentSignal;
import com.example.fleetsafety.domain.Severity;
import com.example.fleetsafety.domain.Signal;
import com.example.fleetsafety.repository.AlertRepository;
import com.example.fleetsafety.repository.IncidentAlertRepository;
import com.example.fleetsafety.repository.IncidentRepository;
import com.example.fleetsafety.repository.IncidentSignalRepository;
import com.example.fleetsafety.repository.SignalRepository;
import com.example.fleetsafety.service.AiAssessment;
import com.example.fleetsafety.service.AlertActivityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Incident correlation: opens incidents from alerts and detected patterns,
 * links related signals and alerts, and moves incidents through their
 * status table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentService {

    private static final DateTimeFormatter BUCKET_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm").withZone(ZoneOffset.UTC);
    private static final double SUPPORTING_RELEVANCE = 0.5;

    private final IncidentRepository incidentRepository;
    private final IncidentSignalRepository incidentSignalRepository;
    private final IncidentAlertRepository incidentAlertRepository;
    private final AlertRepository alertRepository;
    private final SignalRepository signalRepository;
    private final CompanyConfigResolver configResolver;
    private final AlertActivityService activityService;
    private final Clock clock;

    /**
     * {@code type:subjectType:subjectId:bucket}, with the timestamp floored to
     * a {@code bucketMinutes} boundary (UTC). Null subject parts are left out.
     */
    public static String generateDedupeKey(Incident.IncidentType type, Incident.SubjectType subjectType,
                                           String subjectId, Instant detectedAt, int bucketMinutes) {
        if (bucketMinutes <= 0) {
            throw new IllegalArgumentException("bucketMinutes must be positive: " + bucketMinutes);
        }
        long bucketSeconds = bucketMinutes * 60L;
        Instant floored = Instant.ofEpochSecond(Math.floorDiv(detectedAt.getEpochSecond(), bucketSeconds) * bucketSeconds);

        List<String> parts = new ArrayList<>();
        if (type != null) parts.add(type.value());
        if (subjectType != null) parts.add(subjectType.value());
        if (subjectId != null && !subjectId.isEmpty()) parts.add(subjectId);
        parts.add(BUCKET_FORMAT.format(floored));
        return String.join(":", parts);
    }

    /**
     * Critical alerts, high-risk verdicts and call/emergency escalations always
     * qualify; likely false positives and info alerts never do; warnings
     * qualify with high or medium likelihood.
     */
    public boolean shouldCreateIncident(Alert alert, AiAssessment assessment) {
        Alert.Verdict verdict = assessment != null && assessment.getVerdict() != null
                ? assessment.getVerdict() : alert.getVerdict();
        Alert.RiskEscalation risk = assessment != null && assessment.getRiskEscalation() != null
                ? assessment.getRiskEscalation() : alert.getRiskEscalation();
        Alert.Likelihood likelihood = assessment != null && assessment.getLikelihood() != null
                ? assessment.getLikelihood() : alert.getLikelihood();

        if (alert.getSeverity() == Severity.CRITICAL) return true;
        if (verdict == Alert.Verdict.REAL_PANIC || verdict == Alert.Verdict.CONFIRMED_VIOLATION
                || verdict == Alert.Verdict.RISK_DETECTED) {
            return true;
        }
        if (risk == Alert.RiskEscalation.CALL || risk == Alert.RiskEscalation.EMERGENCY) return true;
        if (verdict == Alert.Verdict.LIKELY_FALSE_POSITIVE) return false;

        return switch (alert.getSeverity()) {
            case WARNING -> likelihood == Alert.Likelihood.HIGH || likelihood == Alert.Likelihood.MEDIUM;
            case CRITICAL -> true;
            case INFO -> false;
        };
    }

    /**
     * Opens an incident for an alert, or returns the one already open for the
     * same source event. The alert is linked as primary and nearby signals of
     * the same vehicle (or driver) as supporting.
     */
    @Transactional
    public Incident createFromAlert(String alertId, AiAssessment assessment) {
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new IllegalArgumentException("Alert not found: " + alertId));
        Signal signal = alert.getSignal();
        String sourceEventId = signal != null ? signal.getSourceEventId() : null;

        if (sourceEventId != null) {
            Optional<Incident> existing = incidentRepository.findFirstByCompanyIdAndSourceEventId(alert.getCompanyId(), sourceEventId);
            if (existing.isPresent()) {
                log.info("Incident {} already exists for event {}", existing.get().getId(), sourceEventId);
                return existing.get();
            }
        }

        boolean byDriver = signal != null && signal.getDriverId() != null;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("alert_id", alert.getId());
        if (alert.getEventDescription() != null) metadata.put("event_description", alert.getEventDescription());

        Incident incident = incidentRepository.save(Incident.builder()
                .companyId(alert.getCompanyId())
                .incidentType(determineType(alert))
                .priority(determinePriority(alert, assessment))
                .status(Incident.IncidentStatus.OPEN)
                .subjectType(signal == null ? null : byDriver ? Incident.SubjectType.DRIVER : Incident.SubjectType.VEHICLE)
                .subjectId(signal == null ? null : byDriver ? signal.getDriverId() : signal.getVehicleId())
                .subjectName(signal == null ? null : byDriver ? signal.getDriverName() : signal.getVehicleName())
                .source(Incident.Source.ALERT)
                .sourceEventId(sourceEventId)
                .aiSummary(alert.getAiMessage())
                .metadata(metadata)
                .detectedAt(alert.getOccurredAt() != null ? alert.getOccurredAt() : clock.instant())
                .createdAt(clock.instant())
                .build());
        log.info("Opened incident {} ({}, {}) from alert {}", incident.getId(),
                incident.getIncidentType().value(), incident.getPriority(), alert.getId());

        linkAlert(incident.getId(), alert.getId(), Incident.LinkRole.PRIMARY);
        linkRelatedSignals(incident, alert);
        return incident;
    }

    /** Incident for an auto-detected pattern, deduplicated by {@link #generateDedupeKey}. */
    @Transactional
    public Incident createFromPattern(Long companyId, String patternType, Incident.SubjectType subjectType,
                                      String subjectId, String subjectName, Instant detectedAt,
                                      Map<String, Object> metadata) {
        CompanyConfig config = configResolver.resolve(companyId);
        Instant at = detectedAt != null ? detectedAt : clock.instant();
        String dedupeKey = generateDedupeKey(Incident.IncidentType.PATTERN, subjectType, subjectId, at,
                config.getIncidents().getDedupeWindowMinutes());

        Optional<Incident> existing = incidentRepository.findFirstByCompanyIdAndDedupeKey(companyId, dedupeKey);
        if (existing.isPresent()) {
            log.info("Incident {} already exists for dedupe key {}", existing.get().getId(), dedupeKey);
            return existing.get();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        if (metadata != null) details.putAll(metadata);
        details.put("pattern_type", patternType);

        Incident incident = incidentRepository.save(Incident.builder()
                .companyId(companyId)
                .incidentType(Incident.IncidentType.PATTERN)
                .priority(Incident.Priority.P3)
                .status(Incident.IncidentStatus.OPEN)
                .subjectType(subjectType)
                .subjectId(subjectId)
                .subjectName(subjectName)
                .source(Incident.Source.AUTO_PATTERN)
                .dedupeKey(dedupeKey)
                .metadata(details)
                .detectedAt(at)
                .createdAt(clock.instant())
                .build());
        log.info("Opened pattern incident {} ({})", incident.getId(), dedupeKey);
        return incident;
    }

    /** Returns false when the signal was already linked. */
    @Transactional
    public boolean linkSignal(String incidentId, String signalId, Incident.LinkRole role, Double relevanceScore) {
        if (incidentSignalRepository.existsByIncidentIdAndSignalId(incidentId, signalId)) {
            return false;
        }
        incidentSignalRepository.save(IncidentSignal.builder()
                .incidentId(incidentId)
                .signalId(signalId)
                .role(role)
                .relevanceScore(relevanceScore)
                .createdAt(clock.instant())
                .build());
        return true;
    }

    @Transactional
    public boolean linkAlert(String incidentId, String alertId, Incident.LinkRole role) {
        if (incidentAlertRepository.existsByIncidentIdAndAlertId(incidentId, alertId)) {
            return false;
        }
        incidentAlertRepository.save(IncidentAlert.builder()
                .incidentId(incidentId)
                .alertId(alertId)
                .role(role)
                .createdAt(clock.instant())
                .build());
        alertRepository.findById(alertId).ifPresent(alert ->
                activityService.logSystemAction(alert, AlertActivity.Action.INCIDENT_LINKED,
                        Map.of("incident_id", incidentId, "role", role.name().toLowerCase(Locale.ROOT))));
        return true;
    }

    @Transactional
    public Incident transition(String incidentId, Incident.IncidentStatus target) {
        Incident incident = lock(incidentId);
        Incident.IncidentStatus from = incident.getStatus();
        incident.transitionTo(target, clock.instant());
        log.info("Incident {} status {} -> {}", incidentId, from.value(), target.value());
        return incidentRepository.save(incident);
    }

    @Transactional
    public Incident resolve(String incidentId, String summary) {
        Incident incident = lock(incidentId);
        incident.markAsResolved(summary, clock.instant());
        log.info("Incident {} resolved", incidentId);
        return incidentRepository.save(incident);
    }

    @Transactional
    public Incident markAsFalsePositive(String incidentId, String reason) {
        Incident incident = lock(incidentId);
        incident.markAsFalsePositive(reason, clock.instant());
        log.info("Incident {} marked as false positive", incidentId);
        return incidentRepository.save(incident);
    }

    @Transactional(readOnly = true)
    public List<IncidentSignal> linkedSignals(String incidentId) {
        return incidentSignalRepository.findByIncidentId(incidentId);
    }

    @Transactional(readOnly = true)
    public List<IncidentAlert> linkedAlerts(String incidentId) {
        return incidentAlertRepository.findByIncidentId(incidentId);
    }

    /** Incidents of the company that are not resolved or marked false positive. */
    @Transactional(readOnly = true)
    public List<Incident> openIncidents(Long companyId) {
        return incidentRepository.findByCompanyIdAndStatusIn(companyId, List.of(
                Incident.IncidentStatus.OPEN, Incident.IncidentStatus.INVESTIGATING,
                Incident.IncidentStatus.PENDING_ACTION));
    }

    @Transactional(readOnly = true)
    public List<IncidentAlert> incidentsForAlert(String alertId) {
        return incidentAlertRepository.findByAlertId(alertId);
    }

    private Incident lock(String incidentId) {
        return incidentRepository.findByIdForUpdate(incidentId)
                .orElseThrow(() -> new IllegalArgumentException("Incident not found: " + incidentId));
    }

    private void linkRelatedSignals(Incident incident, Alert alert) {
        Signal signal = alert.getSignal();
        if (alert.getOccurredAt() == null || signal == null) return;

        int window = configResolver.resolve(alert.getCompanyId()).getIncidents().getSignalSearchWindowMinutes();
        Instant from = alert.getOccurredAt().minus(Duration.ofMinutes(window));
        Instant to = alert.getOccurredAt().plus(Duration.ofMinutes(window));

        List<Signal> related;
        if (signal.getVehicleId() != null) {
            related = signalRepository.findForVehicleBetween(alert.getCompanyId(), signal.getVehicleId(), from, to);
        } else if (signal.getDriverId() != null) {
            related = signalRepository.findForDriverBetween(alert.getCompanyId(), signal.getDriverId(), from, to);
        } else {
            return;
        }

        int linked = 0;
        for (Signal candidate : related) {
            Incident.LinkRole role = candidate.getId().equals(signal.getId())
                    ? Incident.LinkRole.PRIMARY : Incident.LinkRole.SUPPORTING;
            double relevance = role == Incident.LinkRole.PRIMARY ? 1.0 : SUPPORTING_RELEVANCE;
            if (linkSignal(incident.getId(), candidate.getId(), role, relevance)) linked++;
        }
        log.debug("Linked {} signals to incident {} (+/-{} min)", linked, incident.getId(), window);
    }

    private static Incident.Priority determinePriority(Alert alert, AiAssessment assessment) {
        Alert.RiskEscalation risk = assessment != null && assessment.getRiskEscalation() != null
                ? assessment.getRiskEscalation() : alert.getRiskEscalation();
        Alert.Likelihood likelihood = assessment != null && assessment.getLikelihood() != null
                ? assessment.getLikelihood() : alert.getLikelihood();

        if (alert.getSeverity() == Severity.CRITICAL || risk == Alert.RiskEscalation.EMERGENCY) {
            return Incident.Priority.P1;
        }
        if (risk == Alert.RiskEscalation.CALL || likelihood == Alert.Likelihood.HIGH) {
            return Incident.Priority.P2;
        }
        if (alert.getSeverity() == Severity.WARNING || risk == Alert.RiskEscalation.WARN) {
            return Incident.Priority.P3;
        }
        return Incident.Priority.P4;
    }

    private static Incident.IncidentType determineType(Alert alert) {
        String description = alert.getEventDescription() != null
                ? alert.getEventDescription().toLowerCase(Locale.ROOT) : "";
        Alert.AlertKind kind = alert.getAlertKind();

        if (description.contains("collision") || description.contains("crash")) {
            return Incident.IncidentType.COLLISION;
        }
        if (description.contains("panic") || description.contains("emergency") || kind == Alert.AlertKind.PANIC) {
            return Incident.IncidentType.EMERGENCY;
        }
        if (description.contains("obstruct") || description.contains("tampering") || kind == Alert.AlertKind.TAMPERING) {
            return Incident.IncidentType.TAMPERING;
        }
        if (kind == Alert.AlertKind.SAFETY || description.contains("speeding") || description.contains("seatbelt")) {
            return Incident.IncidentType.SAFETY_VIOLATION;
        }
        return Incident.IncidentType.UNKNOWN;
    }
}
