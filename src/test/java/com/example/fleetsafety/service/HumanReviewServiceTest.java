package com.example.fleetsafety.service;

import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.AlertActivity;
import com.example.fleetsafety.domain.AlertComment;
import com.example.fleetsafety.domain.Severity;
import com.example.fleetsafety.repository.AlertCommentRepository;
import com.example.fleetsafety.repository.AlertRepository;
import com.example.fleetsafety.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.example.fleetsafety.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HumanReviewServiceTest {

    @Mock private AlertRepository alertRepository;
    @Mock private AlertCommentRepository commentRepository;
    @Mock private AlertActivityService activityService;

    private Alert alert;
    private HumanReviewService service;

    @BeforeEach
    void setUp() {
        alert = TestDataFactory.createAlert("a-1", Alert.AiStatus.COMPLETED, Severity.CRITICAL);
        service = new HumanReviewService(alertRepository, commentRepository, activityService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void setHumanStatus_stampsReviewerAndLogsActivity() {
        when(alertRepository.findByIdForUpdate("a-1")).thenReturn(Optional.of(alert));
        when(alertRepository.save(alert)).thenReturn(alert);

        Alert result = service.setHumanStatus("a-1", "flagged", 11L);

        assertThat(result.getHumanStatus()).isEqualTo(Alert.HumanStatus.FLAGGED);
        assertThat(result.getReviewedById()).isEqualTo(11L);
        assertThat(result.getReviewedAt()).isEqualTo(NOW);
        assertThat(result.isHumanReviewed()).isTrue();
        verify(activityService).logHumanAction(alert, 11L, AlertActivity.Action.HUMAN_STATUS_CHANGED,
                Map.of("old_status", "pending", "new_status", "flagged"));
    }

    @Test
    void setHumanStatus_allowsAnyStatusFromAnyOther() {
        alert.setHumanStatus(Alert.HumanStatus.FLAGGED);
        when(alertRepository.findByIdForUpdate("a-1")).thenReturn(Optional.of(alert));
        when(alertRepository.save(alert)).thenReturn(alert);

        service.setHumanStatus("a-1", "resolved", 12L);

        assertThat(alert.getHumanStatus()).isEqualTo(Alert.HumanStatus.RESOLVED);
    }

    @Test
    void setHumanStatus_invalidValue_changesNothing() {
        assertThatThrownBy(() -> service.setHumanStatus("a-1", "escalated", 11L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid human_status");

        assertThat(alert.getHumanStatus()).isEqualTo(Alert.HumanStatus.PENDING);
        verifyNoInteractions(alertRepository, activityService);
    }

    @ParameterizedTest
    @ValueSource(strings = {"REVIEWED", " reviewed", "reviewed ", "Flagged"})
    void setHumanStatus_caseOrWhitespaceVariant_isRejected(String raw) {
        assertThatThrownBy(() -> service.setHumanStatus("a-1", raw, 11L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid human_status: " + raw);

        assertThat(alert.getHumanStatus()).isEqualTo(Alert.HumanStatus.PENDING);
        verifyNoInteractions(alertRepository, activityService);
    }

    @Test
    void addComment_persistsAndLogsActivity() {
        when(alertRepository.findById("a-1")).thenReturn(Optional.of(alert));
        when(commentRepository.save(any(AlertComment.class))).thenAnswer(inv -> {
            AlertComment comment = inv.getArgument(0);
            comment.setId("c-1");
            return comment;
        });

        AlertComment comment = service.addComment("a-1", 11L, "Driver confirmed he is fine");

        assertThat(comment.getAlertId()).isEqualTo("a-1");
        assertThat(comment.getUserId()).isEqualTo(11L);
        assertThat(comment.getCreatedAt()).isEqualTo(NOW);
        verify(activityService).logHumanAction(alert, 11L, AlertActivity.Action.COMMENT_ADDED,
                Map.of("comment_id", "c-1"));
    }

    @Test
    void addComment_blankContentRejected() {
        assertThatThrownBy(() -> service.addComment("a-1", 11L, "  "))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(commentRepository, activityService);
    }

    @Test
    void getComments_oldestFirst() {
        AlertComment first = AlertComment.builder().id("c-1").alertId("a-1").content("one").build();
        AlertComment second = AlertComment.builder().id("c-2").alertId("a-1").content("two").build();
        when(commentRepository.findByAlertIdOrderByCreatedAtAsc("a-1")).thenReturn(List.of(first, second));

        assertThat(service.getComments("a-1")).containsExactly(first, second);
    }
}
