package com.example.fleetsafety.service;

import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.AlertActivity;
import com.example.fleetsafety.domain.Severity;
import com.example.fleetsafety.repository.AlertActivityRepository;
import com.example.fleetsafety.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Map;

import static com.example.fleetsafety.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertActivityServiceTest {

    @Mock private AlertActivityRepository activityRepository;

    private AlertActivityService service;

    @BeforeEach
    void setUp() {
        service = new AlertActivityService(activityRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        when(activityRepository.save(any(AlertActivity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void humanActionsCarryTheUser() {
        Alert alert = TestDataFactory.createAlert("a-1", Alert.AiStatus.COMPLETED, Severity.WARNING);

        AlertActivity entry = service.logHumanAction(alert, 5L, AlertActivity.Action.ATTENTION_ACKED, null);

        assertThat(entry.getActorType()).isEqualTo(AlertActivity.ActorType.HUMAN);
        assertThat(entry.getUserId()).isEqualTo(5L);
        assertThat(entry.getCompanyId()).isEqualTo(alert.getCompanyId());
        assertThat(entry.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void systemAndAiActionsHaveNoUser() {
        Alert alert = TestDataFactory.createAlert("a-1", Alert.AiStatus.COMPLETED, Severity.WARNING);

        AlertActivity system = service.logSystemAction(alert, AlertActivity.Action.ATTENTION_ESCALATED,
                Map.of("escalation_level", 1));
        AlertActivity ai = service.logAiAction(alert, AlertActivity.Action.AI_STATUS_CHANGED, null);

        assertThat(system.getActorType()).isEqualTo(AlertActivity.ActorType.SYSTEM);
        assertThat(system.getUserId()).isNull();
        assertThat(system.getMetadata()).containsEntry("escalation_level", 1);
        assertThat(ai.getActorType()).isEqualTo(AlertActivity.ActorType.AI);
        assertThat(ai.getAction().value()).isEqualTo("ai_status_changed");
    }
}
