package com.example.fleetsafety.attention;

import com.example.fleetsafety.config.FleetSafetyProperties;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.NotificationDecision;
import com.example.fleetsafety.domain.Severity;
import com.example.fleetsafety.repository.AlertRepository;
import com.example.fleetsafety.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.example.fleetsafety.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AttentionSweeperTest {

    @Mock private AlertRepository alertRepository;
    @Mock private AttentionService attentionService;

    private FleetSafetyProperties properties;
    private AttentionSweeper sweeper;

    @BeforeEach
    void setUp() {
        properties = new FleetSafetyProperties();
        properties.getAttention().setBatchSize(25);
        sweeper = new AttentionSweeper(alertRepository, attentionService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void checkAndEscalateOverdue_countsOnlyEscalatedAlerts() {
        Alert first = TestDataFactory.createAlert("a-1", Alert.AiStatus.COMPLETED, Severity.CRITICAL);
        Alert second = TestDataFactory.createAlert("a-2", Alert.AiStatus.COMPLETED, Severity.CRITICAL);
        when(alertRepository.findDueForEscalation(Alert.AttentionState.NEEDS_ATTENTION, Alert.AckStatus.PENDING,
                NOW, PageRequest.of(0, 25))).thenReturn(List.of(first, second));
        when(attentionService.escalate("a-1")).thenReturn(NotificationDecision.builder().alertId("a-1").build());
        when(attentionService.escalate("a-2")).thenReturn(null);

        assertThat(sweeper.checkAndEscalateOverdue()).isEqualTo(1);
    }

    @Test
    void checkAndEscalateOverdue_failureDoesNotStopTheBatch() {
        Alert broken = TestDataFactory.createAlert("broken", Alert.AiStatus.COMPLETED, Severity.CRITICAL);
        Alert healthy = TestDataFactory.createAlert("healthy", Alert.AiStatus.COMPLETED, Severity.CRITICAL);
        when(alertRepository.findDueForEscalation(Alert.AttentionState.NEEDS_ATTENTION, Alert.AckStatus.PENDING,
                NOW, PageRequest.of(0, 25))).thenReturn(List.of(broken, healthy));
        when(attentionService.escalate("broken")).thenThrow(new IllegalStateException("lock timeout"));
        when(attentionService.escalate("healthy")).thenReturn(NotificationDecision.builder().alertId("healthy").build());

        assertThat(sweeper.checkAndEscalateOverdue()).isEqualTo(1);
        verify(attentionService).escalate("healthy");
    }

    @Test
    void checkAndEscalateOverdue_disabled_doesNothing() {
        properties.getAttention().setEnabled(false);

        assertThat(sweeper.checkAndEscalateOverdue()).isZero();
        verifyNoInteractions(alertRepository, attentionService);
    }
}
