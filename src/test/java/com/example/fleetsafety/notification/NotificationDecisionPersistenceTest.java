package com.example.fleetsafety.notification;

import com.example.fleetsafety.domain.NotificationDecision;
import com.example.fleetsafety.domain.NotificationRecipient;
import com.example.fleetsafety.repository.NotificationDecisionRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs without a test-managed transaction so that each call commits or
 * rolls back on its own.
 */
@SpringBootTest
class NotificationDecisionPersistenceTest {

    @Autowired private NotificationDecisionService decisionService;
    @Autowired private NotificationDecisionRepository decisionRepository;
    @Autowired private TransactionTemplate transactionTemplate;

    private static RecipientDraft recipient(String name, int priority) {
        return RecipientDraft.builder()
                .recipientType(NotificationRecipient.RecipientType.SUPERVISOR)
                .name(name)
                .phone("+15550000002")
                .priority(priority)
                .build();
    }

    private static DecisionDraft draft() {
        return DecisionDraft.builder()
                .shouldNotify(true)
                .escalationLevel("high")
                .channels(List.of("call"))
                .dedupeKey("persist-check")
                .build();
    }

    @Test
    void failingRecipientRollsBackWholeDecision() {
        String alertId = "alert-rollback";

        assertThrows(RuntimeException.class, () -> decisionService.createWithRecipients(alertId, draft(),
                List.of(recipient("Supervisor", 1), recipient("x".repeat(300), 2))));

        assertTrue(decisionRepository.findByAlertIdOrderBySequenceDesc(alertId).isEmpty());
    }

    @Test
    void decisionAndRecipientsCommitTogether() {
        String alertId = "alert-commit";

        decisionService.createWithRecipients(alertId, draft(),
                List.of(recipient("Night Supervisor", 2), recipient("Day Supervisor", 1)));

        List<String> names = transactionTemplate.execute(status -> decisionService.latestDecision(alertId)
                .map(NotificationDecision::getRecipients)
                .orElseThrow()
                .stream()
                .map(NotificationRecipient::getName)
                .toList());
        assertEquals(List.of("Day Supervisor", "Night Supervisor"), names);
    }

    @Test
    void latestDecisionFollowsCreationOrder() {
        String alertId = "alert-latest";

        decisionService.createWithRecipients(alertId, draft(), List.of(recipient("Supervisor", 1)));
        decisionService.createWithRecipients(alertId, DecisionDraft.builder()
                .shouldNotify(false)
                .escalationLevel("none")
                .dedupeKey("second")
                .build(), List.of());

        NotificationDecision latest = decisionService.latestDecision(alertId).orElseThrow();
        assertEquals("second", latest.getDedupeKey());
        assertEquals(2, latest.getSequence());
        assertEquals(List.of(2, 1), decisionService.history(alertId).stream()
                .map(NotificationDecision::getSequence)
                .toList());
    }
}
