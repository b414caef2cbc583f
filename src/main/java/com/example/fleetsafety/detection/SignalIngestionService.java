package com.example.fleetsafety.detection;

import com.example.fleetsafety.config.CompanyConfig;
import com.example.fleetsafety.config.CompanyConfigResolver;
import com.example.fleetsafety.config.DetectionRule;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.NotificationDecision;
import com.example.fleetsafety.domain.Signal;
import com.example.fleetsafety.event.AlertTriageRequestedEvent;
import com.example.fleetsafety.notification.NotificationDecisionService;
import com.example.fleetsafety.repository.AlertRepository;
import com.example.fleetsafety.repository.SignalRepository;
import com.example.fleetsafety.service.AlertLifecycleService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for safety events from the stream. Upserts the signal and, for
 * new signals matching a detection rule, opens an alert and routes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalIngestionService {

    private final SignalRepository signalRepository;
    private final AlertRepository alertRepository;
    private final CompanyConfigResolver configResolver;
    private final RuleMatcher ruleMatcher;
    private final SeverityClassifier severityClassifier;
    private final NotificationDecisionService decisionService;
    private final AlertLifecycleService lifecycleService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public SignalDisposition ingest(Long companyId, SignalPayload payload) {
        if (payload == null || payload.getSourceEventId() == null || payload.getSourceEventId().isBlank()) {
            throw new IllegalArgumentException("Signal payload requires a source_event_id");
        }

        Optional<Signal> existing = signalRepository.findByCompanyIdAndSourceEventId(companyId, payload.getSourceEventId());
        if (existing.isPresent()) {
            Signal updated = signalRepository.save(refresh(existing.get(), payload));
            log.debug("Signal {} updated for company {}", updated.getSourceEventId(), companyId);
            return new SignalDisposition(updated, false, null, null, null, null);
        }

        Signal signal = signalRepository.save(newSignal(companyId, payload));
        CompanyConfig config = configResolver.resolve(companyId);

        Optional<DetectionRule> match = ruleMatcher.match(signal, config);
        if (match.isEmpty()) {
            return new SignalDisposition(signal, true, null, null, null, null);
        }
        DetectionRule rule = match.get();
        RuleAction action = rule.resolvedAction();
        Counter.builder("fleet_safety.rules.matched")
                .tag("action", action.value())
                .register(meterRegistry)
                .increment();

        if (alertRepository.existsByCompanyIdAndSignal_SourceEventId(companyId, signal.getSourceEventId())) {
            log.warn("Alert already exists for event {} in company {}, skipping", signal.getSourceEventId(), companyId);
            return new SignalDisposition(signal, true, rule, action, null, null);
        }

        Alert alert = alertRepository.save(Alert.builder()
                .companyId(companyId)
                .signal(signal)
                .eventDescription(signal.getPrimaryBehaviorLabel())
                .severity(signal.getSeverity())
                .occurredAt(signal.getOccurredAt())
                .aiStatus(Alert.AiStatus.PENDING)
                .humanStatus(Alert.HumanStatus.PENDING)
                .createdAt(clock.instant())
                .build());
        log.info("Signal {} matched rule {} ({}), opened alert {}",
                signal.getSourceEventId(), rule.getId(), action.value(), alert.getId());

        NotificationDecision immediate = null;
        if (action.notifiesImmediately()) {
            String message = immediateMessage(signal);
            immediate = decisionService.decideForAlert(alert, config, Alert.RiskEscalation.WARN,
                    NotificationDecision.EscalationLevel.HIGH, message,
                    "Immediate alert from detection rule " + rule.getId(),
                    "immediate-" + signal.getSourceEventId(), rule);
            if (!action.runsAiPipeline()) {
                alert = lifecycleService.completeWithoutTriage(alert.getId(), message);
            }
        }
        if (action.runsAiPipeline()) {
            eventPublisher.publishEvent(new AlertTriageRequestedEvent(alert.getId(), companyId, rule.getId()));
        }

        return new SignalDisposition(signal, true, rule, action, alert, immediate);
    }

    private Signal newSignal(Long companyId, SignalPayload payload) {
        List<String> labels = payload.labelValues();
        return Signal.builder()
                .companyId(companyId)
                .sourceEventId(payload.getSourceEventId())
                .primaryBehaviorLabel(labels.isEmpty() ? null : labels.get(0))
                .behaviorLabels(new ArrayList<>(labels))
                .severity(severityClassifier.classify(labels))
                .eventState(payload.getEventState())
                .vehicleId(payload.getVehicleId())
                .vehicleName(payload.getVehicleName())
                .driverId(payload.getDriverId())
                .driverName(payload.getDriverName())
                .occurredAt(payload.getOccurredAt() != null ? payload.getOccurredAt() : clock.instant())
                .createdAt(clock.instant())
                .build();
    }

    /** Only event-state fields and soft subject references change on update. */
    private Signal refresh(Signal signal, SignalPayload payload) {
        if (payload.getEventState() != null) signal.setEventState(payload.getEventState());
        List<String> labels = payload.labelValues();
        if (!labels.isEmpty()) {
            signal.setPrimaryBehaviorLabel(labels.get(0));
            signal.setBehaviorLabels(new ArrayList<>(labels));
            signal.setSeverity(severityClassifier.classify(labels));
        }
        if (payload.getVehicleId() != null) signal.setVehicleId(payload.getVehicleId());
        if (payload.getVehicleName() != null) signal.setVehicleName(payload.getVehicleName());
        if (payload.getDriverId() != null) signal.setDriverId(payload.getDriverId());
        if (payload.getDriverName() != null) signal.setDriverName(payload.getDriverName());
        return signal;
    }

    private static String immediateMessage(Signal signal) {
        return String.format("Safety alert: %s - Vehicle: %s, Driver: %s. %s",
                signal.getPrimaryBehaviorLabel() != null ? signal.getPrimaryBehaviorLabel() : "Safety event",
                signal.getVehicleName() != null ? signal.getVehicleName() : "Unknown vehicle",
                signal.getDriverName() != null ? signal.getDriverName() : "Unidentified driver",
                DateTimeFormatter.ISO_INSTANT.format(signal.getOccurredAt()));
    }
}
