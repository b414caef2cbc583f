package com.example.fleetsafety.notification;

import com.example.fleetsafety.config.CompanyConfig;
import com.example.fleetsafety.config.ContactPoint;
import com.example.fleetsafety.config.DetectionRule;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.NotificationDecision;
import com.example.fleetsafety.domain.NotificationRecipient;
import com.example.fleetsafety.event.NotificationDecisionRecordedEvent;
import com.example.fleetsafety.repository.NotificationDecisionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds and records notification decisions.
 *
 * A decision and its recipients are written in one transaction and never
 * updated afterwards; every new decision for an alert is a new row.
 * Dispatch is not done here: a {@link NotificationDecisionRecordedEvent} is
 * published for the dispatch collaborator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDecisionService {

    private static final CompanyConfig.EscalationRoute FALLBACK_ROUTE =
            new CompanyConfig.EscalationRoute(List.of("whatsapp"), List.of("monitoring_team"));

    private final NotificationDecisionRepository decisionRepository;
    private final ContactDirectory contactDirectory;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * The only way to create a decision. Recipients are ordered by ascending
     * priority; equal priorities keep their order in {@code recipients}.
     * A recipient without a priority gets its 1-based position.
     */
    @Transactional
    public NotificationDecision createWithRecipients(String alertId, DecisionDraft draft,
                                                     List<RecipientDraft> recipients) {
        List<NotificationRecipient> built = new ArrayList<>();
        List<RecipientDraft> drafts = recipients != null ? recipients : List.of();
        for (int i = 0; i < drafts.size(); i++) {
            RecipientDraft r = drafts.get(i);
            built.add(NotificationRecipient.builder()
                    .recipientType(r.getRecipientType() != null
                            ? r.getRecipientType() : NotificationRecipient.RecipientType.OTHER)
                    .name(r.getName())
                    .phone(r.getPhone())
                    .whatsapp(r.getWhatsapp())
                    .priority(r.getPriority() != null ? r.getPriority() : i + 1)
                    .position(i)
                    .build());
        }
        built.sort(Comparator.comparingInt(NotificationRecipient::getPriority));

        NotificationDecision decision = NotificationDecision.builder()
                .alertId(alertId)
                .sequence((int) decisionRepository.countByAlertId(alertId) + 1)
                .shouldNotify(draft.isShouldNotify())
                .escalationLevel(NotificationDecision.EscalationLevel.normalize(draft.getEscalationLevel()))
                .messageText(draft.getMessageText())
                .callScript(draft.getCallScript())
                .reason(draft.getReason())
                .dedupeKey(draft.getDedupeKey())
                .channels(draft.getChannels())
                .recipients(built)
                .createdAt(clock.instant())
                .build();
        NotificationDecision saved = decisionRepository.save(decision);

        Counter.builder("fleet_safety.notification.decisions")
                .tag("level", saved.getEscalationLevel().value())
                .register(meterRegistry)
                .increment();
        log.info("Notification decision {} for alert {}: notify={}, level={}, recipients={}",
                saved.getId(), alertId, saved.isShouldNotify(), saved.getEscalationLevel().value(), built.size());

        eventPublisher.publishEvent(new NotificationDecisionRecordedEvent(saved.getId(), alertId, saved.isShouldNotify()));
        return saved;
    }

    /**
     * Decision for one row of the escalation matrix. Channels and recipients
     * of {@code ruleOverride} take precedence over the matrix row. Contacts of
     * the requested types come first; when none of them resolve, every known
     * contact is used.
     */
    @Transactional
    public NotificationDecision decideForAlert(Alert alert, CompanyConfig config, Alert.RiskEscalation matrixKey,
                                               NotificationDecision.EscalationLevel level, String messageText,
                                               String reason, String dedupeKey, DetectionRule ruleOverride) {
        CompanyConfig.EscalationRoute route = routeFor(config, matrixKey);
        List<String> channels = ruleOverride != null && ruleOverride.getChannels() != null
                && !ruleOverride.getChannels().isEmpty() ? ruleOverride.getChannels() : route.getChannels();
        List<String> requested = ruleOverride != null && ruleOverride.getRecipients() != null
                && !ruleOverride.getRecipients().isEmpty() ? ruleOverride.getRecipients() : route.getRecipients();

        String vehicleId = alert.getSignal() != null ? alert.getSignal().getVehicleId() : null;
        String driverId = alert.getSignal() != null ? alert.getSignal().getDriverId() : null;
        Map<NotificationRecipient.RecipientType, ContactPoint> contacts =
                contactDirectory.resolve(alert.getCompanyId(), vehicleId, driverId);

        List<RecipientDraft> recipients = new ArrayList<>();
        if (requested != null) {
            for (String type : requested) {
                NotificationRecipient.RecipientType recipientType = NotificationRecipient.RecipientType.fromValue(type);
                ContactPoint contact = contacts.get(recipientType);
                if (contact != null && recipients.stream().noneMatch(r -> r.getRecipientType() == recipientType)) {
                    recipients.add(toDraft(recipientType, contact));
                }
            }
        }
        if (recipients.isEmpty() && !contacts.isEmpty()) {
            log.debug("No contact for requested types {} on alert {}, using all contacts", requested, alert.getId());
            contacts.forEach((type, contact) -> recipients.add(toDraft(type, contact)));
        }

        boolean shouldNotify = !recipients.isEmpty() && channels != null && !channels.isEmpty();
        if (!shouldNotify) {
            log.warn("Alert {} has no reachable recipients for '{}'", alert.getId(), matrixKey.value());
        }

        DecisionDraft draft = DecisionDraft.builder()
                .shouldNotify(shouldNotify)
                .escalationLevel(level.value())
                .messageText(messageText)
                .reason(reason)
                .dedupeKey(dedupeKey)
                .channels(channels)
                .build();
        return createWithRecipients(alert.getId(), draft, recipients);
    }

    /**
     * Records the decision handed back by the AI pipeline. Values are taken
     * as-is apart from the escalation level, which is normalized.
     */
    @Transactional
    public NotificationDecision recordFromPayload(String alertId, Map<String, Object> payload) {
        List<RecipientDraft> recipients = new ArrayList<>();
        if (payload.get("recipients") instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    recipients.add(RecipientDraft.builder()
                            .recipientType(NotificationRecipient.RecipientType.fromValue(asString(map.get("recipient_type"))))
                            .name(asString(map.get("name")))
                            .phone(asString(map.get("phone")))
                            .whatsapp(asString(map.get("whatsapp")))
                            .priority(map.get("priority") instanceof Number n ? n.intValue() : null)
                            .build());
                }
            }
        }
        List<String> channels = new ArrayList<>();
        if (payload.get("channels") instanceof List<?> list) {
            list.forEach(c -> channels.add(String.valueOf(c)));
        }

        DecisionDraft draft = DecisionDraft.builder()
                .shouldNotify(Boolean.TRUE.equals(payload.get("should_notify")))
                .escalationLevel(asString(payload.get("escalation_level")))
                .messageText(asString(payload.get("message_text")))
                .callScript(asString(payload.get("call_script")))
                .reason(asString(payload.get("reason")))
                .dedupeKey(asString(payload.get("dedupe_key")))
                .channels(channels)
                .build();
        return createWithRecipients(alertId, draft, recipients);
    }

    @Transactional(readOnly = true)
    public Optional<NotificationDecision> latestDecision(String alertId) {
        return decisionRepository.findFirstByAlertIdOrderBySequenceDesc(alertId);
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<NotificationDecision> history(String alertId) {
        return decisionRepository.findByAlertIdOrderBySequenceDesc(alertId);
    }

    private static CompanyConfig.EscalationRoute routeFor(CompanyConfig config, Alert.RiskEscalation matrixKey) {
        Map<String, CompanyConfig.EscalationRoute> matrix = config.getEscalationMatrix();
        CompanyConfig.EscalationRoute route = matrix != null ? matrix.get(matrixKey.value()) : null;
        return route != null ? route : FALLBACK_ROUTE;
    }

    private static RecipientDraft toDraft(NotificationRecipient.RecipientType type, ContactPoint contact) {
        return RecipientDraft.builder()
                .recipientType(type)
                .name(contact.getName())
                .phone(contact.getPhone())
                .whatsapp(contact.getWhatsapp())
                .priority(contact.getPriority())
                .build();
    }

    private static String asString(Object value) {
        return value != null ? String.valueOf(value) : null;
    }
}
