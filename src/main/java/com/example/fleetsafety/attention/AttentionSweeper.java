package com.example.fleetsafety.attention;

import com.example.fleetsafety.config.FleetSafetyProperties;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.NotificationDecision;
import com.example.fleetsafety.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Finds alerts whose acknowledgement is overdue for the next escalation step
 * and escalates each one in its own transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttentionSweeper {

    private final AlertRepository alertRepository;
    private final AttentionService attentionService;
    private final FleetSafetyProperties properties;
    private final Clock clock;

    /**
     * Runs every {@code fleet-safety.attention.interval-ms}, up to {@code fleet-safety.attention.batch-size}
     * alerts per pass.
     *
     * @return number of alerts escalated
     */
    @Scheduled(fixedDelayString = "${fleet-safety.attention.interval-ms:60000}")
    public int checkAndEscalateOverdue() {
        if (!properties.getAttention().isEnabled()) return 0;

        List<Alert> due = alertRepository.findDueForEscalation(Alert.AttentionState.NEEDS_ATTENTION,
                Alert.AckStatus.PENDING, clock.instant(), PageRequest.of(0, properties.getAttention().getBatchSize()));

        int escalated = 0;
        for (Alert alert : due) {
            try {
                NotificationDecision decision = attentionService.escalate(alert.getId());
                if (decision != null) escalated++;
            } catch (Exception e) {
                log.error("Escalation failed for alert {}: {}", alert.getId(), e.getMessage(), e);
            }
        }

        if (escalated > 0) {
            log.info("Attention sweep escalated {} of {} overdue alerts", escalated, due.size());
        }
        return escalated;
    }
}
