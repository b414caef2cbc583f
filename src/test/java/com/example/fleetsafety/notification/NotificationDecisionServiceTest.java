package com.example.fleetsafety.notification;

import com.example.fleetsafety.config.CompanyConfig;
import com.example.fleetsafety.config.ContactPoint;
import com.example.fleetsafety.config.DetectionRule;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.NotificationDecision;
import com.example.fleetsafety.domain.NotificationRecipient;
import com.example.fleetsafety.domain.Severity;
import com.example.fleetsafety.event.NotificationDecisionRecordedEvent;
import com.example.fleetsafety.repository.NotificationDecisionRepository;
import com.example.fleetsafety.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.fleetsafety.testutil.TestDataFactory.COMPANY_ID;
import static com.example.fleetsafety.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationDecisionServiceTest {

    @Mock private NotificationDecisionRepository decisionRepository;
    @Mock private ContactDirectory contactDirectory;
    @Mock private ApplicationEventPublisher eventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private NotificationDecisionService service;
    private Alert alert;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new NotificationDecisionService(decisionRepository, contactDirectory, eventPublisher,
                meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
        alert = TestDataFactory.createAlert("a-1", Alert.AiStatus.COMPLETED, Severity.CRITICAL);
        when(decisionRepository.save(any(NotificationDecision.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static RecipientDraft draft(String name, Integer priority) {
        return RecipientDraft.builder()
                .recipientType(NotificationRecipient.RecipientType.SUPERVISOR)
                .name(name)
                .phone("+1555" + name)
                .priority(priority)
                .build();
    }

    private static Map<NotificationRecipient.RecipientType, ContactPoint> contacts() {
        Map<NotificationRecipient.RecipientType, ContactPoint> contacts = new LinkedHashMap<>();
        contacts.put(NotificationRecipient.RecipientType.MONITORING_TEAM,
                new ContactPoint("Monitoring Desk", null, "+15550000001", 2));
        contacts.put(NotificationRecipient.RecipientType.SUPERVISOR,
                new ContactPoint("Supervisor", "+15550000002", null, 1));
        return contacts;
    }

    @Test
    void createWithRecipients_sortsByPriorityKeepingInsertionOrder() {
        DecisionDraft decisionDraft = DecisionDraft.builder()
                .shouldNotify(true)
                .escalationLevel(" High ")
                .channels(List.of("call"))
                .build();

        NotificationDecision decision = service.createWithRecipients("a-1", decisionDraft,
                List.of(draft("A", 2), draft("B", 1), draft("C", 2), draft("D", null)));

        assertThat(decision.getEscalationLevel()).isEqualTo(NotificationDecision.EscalationLevel.HIGH);
        assertThat(decision.getCreatedAt()).isEqualTo(NOW);
        assertThat(decision.getRecipients())
                .extracting(NotificationRecipient::getName, NotificationRecipient::getPriority,
                        NotificationRecipient::getPosition)
                .containsExactly(tuple("B", 1, 1), tuple("A", 2, 0), tuple("C", 2, 2), tuple("D", 4, 3));
        assertThat(decision.getRecipients()).allSatisfy(r -> assertThat(r.getDecision()).isSameAs(decision));
    }

    @Test
    void createWithRecipients_unknownLevelEscalatesAndEventIsPublished() {
        NotificationDecision decision = service.createWithRecipients("a-1",
                DecisionDraft.builder().shouldNotify(false).escalationLevel("urgent").build(), null);

        assertThat(decision.getEscalationLevel()).isEqualTo(NotificationDecision.EscalationLevel.CRITICAL);
        assertThat(decision.getRecipients()).isEmpty();
        verify(eventPublisher).publishEvent(new NotificationDecisionRecordedEvent(null, "a-1", false));
        assertThat(meterRegistry.get("fleet_safety.notification.decisions").tag("level", "critical").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void createWithRecipients_numbersDecisionsPerAlert() {
        when(decisionRepository.countByAlertId("a-1")).thenReturn(2L);

        NotificationDecision decision = service.createWithRecipients("a-1",
                DecisionDraft.builder().shouldNotify(false).escalationLevel("low").build(), List.of());

        assertThat(decision.getSequence()).isEqualTo(3);
    }

    @Test
    void decideForAlert_usesMatrixRowAndContactPriority() {
        when(contactDirectory.resolve(eq(COMPANY_ID), any(), any())).thenReturn(contacts());

        NotificationDecision decision = service.decideForAlert(alert, CompanyConfig.builtIn(), Alert.RiskEscalation.CALL,
                NotificationDecision.EscalationLevel.HIGH, "Call the driver", "Automatic escalation", "escalation-a-1-1", null);

        assertThat(decision.isShouldNotify()).isTrue();
        assertThat(decision.getChannels()).containsExactly("call", "whatsapp", "sms");
        assertThat(decision.getDedupeKey()).isEqualTo("escalation-a-1-1");
        assertThat(decision.getRecipients())
                .extracting(NotificationRecipient::getRecipientType)
                .containsExactly(NotificationRecipient.RecipientType.SUPERVISOR,
                        NotificationRecipient.RecipientType.MONITORING_TEAM);
        assertThat(decision.getRecipients().get(0).bestContactNumber()).isEqualTo("+15550000002");
    }

    @Test
    void decideForAlert_ruleOverridesMatrix() {
        when(contactDirectory.resolve(eq(COMPANY_ID), any(), any())).thenReturn(contacts());
        DetectionRule rule = DetectionRule.builder()
                .id("crash-now")
                .channels(List.of("sms"))
                .recipients(List.of("monitoring"))
                .build();

        NotificationDecision decision = service.decideForAlert(alert, CompanyConfig.builtIn(), Alert.RiskEscalation.WARN,
                NotificationDecision.EscalationLevel.HIGH, "Crash", "Immediate", "immediate-evt-1", rule);

        assertThat(decision.getChannels()).containsExactly("sms");
        assertThat(decision.getRecipients()).extracting(NotificationRecipient::getName).containsExactly("Monitoring Desk");
    }

    @Test
    void decideForAlert_unresolvedTypesFallBackToAllContacts() {
        when(contactDirectory.resolve(eq(COMPANY_ID), any(), any())).thenReturn(contacts());
        DetectionRule rule = DetectionRule.builder().id("r").recipients(List.of("dispatch")).build();

        NotificationDecision decision = service.decideForAlert(alert, CompanyConfig.builtIn(), Alert.RiskEscalation.WARN,
                NotificationDecision.EscalationLevel.LOW, "msg", "reason", "key", rule);

        assertThat(decision.getRecipients()).hasSize(2);
        assertThat(decision.getChannels()).containsExactly("whatsapp", "sms");
    }

    @Test
    void decideForAlert_noContacts_recordsNonNotifyingDecision() {
        when(contactDirectory.resolve(eq(COMPANY_ID), any(), any())).thenReturn(Map.of());

        NotificationDecision decision = service.decideForAlert(alert, CompanyConfig.builtIn(), Alert.RiskEscalation.EMERGENCY,
                NotificationDecision.EscalationLevel.EMERGENCY, "msg", "reason", "key", null);

        assertThat(decision.isShouldNotify()).isFalse();
        assertThat(decision.getEscalationLevel()).isEqualTo(NotificationDecision.EscalationLevel.EMERGENCY);
        verify(decisionRepository).save(decision);
    }

    @Test
    void decideForAlert_monitorRowNeverNotifies() {
        when(contactDirectory.resolve(eq(COMPANY_ID), any(), any())).thenReturn(contacts());

        NotificationDecision decision = service.decideForAlert(alert, CompanyConfig.builtIn(), Alert.RiskEscalation.MONITOR,
                NotificationDecision.EscalationLevel.NONE, "msg", "reason", "key", null);

        assertThat(decision.getChannels()).isEmpty();
        assertThat(decision.isShouldNotify()).isFalse();
    }

    @Test
    void decideForAlert_missingMatrixRowUsesFallbackRoute() {
        when(contactDirectory.resolve(eq(COMPANY_ID), any(), any())).thenReturn(contacts());
        CompanyConfig config = CompanyConfig.builtIn();
        config.setEscalationMatrix(Map.of());

        NotificationDecision decision = service.decideForAlert(alert, config, Alert.RiskEscalation.CALL,
                NotificationDecision.EscalationLevel.HIGH, "msg", "reason", "key", null);

        assertThat(decision.getChannels()).containsExactly("whatsapp");
        assertThat(decision.getRecipients()).extracting(NotificationRecipient::getRecipientType)
                .containsExactly(NotificationRecipient.RecipientType.MONITORING_TEAM);
    }

    @Test
    void recordFromPayload_readsPipelineDecision() {
        Map<String, Object> payload = Map.of(
                "should_notify", true,
                "escalation_level", "EMERGENCY",
                "message_text", "Possible crash",
                "call_script", "Ask if the driver is hurt",
                "dedupe_key", "veh-1:crash",
                "channels", List.of("call", "sms"),
                "recipients", List.of(
                        Map.of("recipient_type", "operator", "name", "Ops", "phone", "+1", "priority", 3),
                        Map.of("recipient_type", "emergency", "name", "911", "phone", "+911", "priority", 1)));

        NotificationDecision decision = service.recordFromPayload("a-1", payload);

        assertThat(decision.isShouldNotify()).isTrue();
        assertThat(decision.getEscalationLevel()).isEqualTo(NotificationDecision.EscalationLevel.EMERGENCY);
        assertThat(decision.getCallScript()).isEqualTo("Ask if the driver is hurt");
        assertThat(decision.getChannels()).containsExactly("call", "sms");
        assertThat(decision.getRecipients()).extracting(NotificationRecipient::getName).containsExactly("911", "Ops");
    }
}
