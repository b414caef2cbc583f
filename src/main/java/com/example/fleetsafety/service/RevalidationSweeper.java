package com.example.fleetsafety.service;

import com.example.fleetsafety.config.CompanyConfigResolver;
import com.example.fleetsafety.config.FleetSafetyProperties;
import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.event.AlertRevalidationDueEvent;
import com.example.fleetsafety.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Polls investigating alerts and hands the ones that are due back to the AI
 * pipeline. Alerts that already spent their investigation budget are closed
 * for manual review instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RevalidationSweeper {

    private final AlertRepository alertRepository;
    private final RevalidationService revalidationService;
    private final CompanyConfigResolver configResolver;
    private final FleetSafetyProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Runs every 60 seconds.
     *
     * @return number of alerts handed off or closed
     */
    @Scheduled(fixedDelayString = "${fleet-safety.revalidation.interval-ms:60000}")
    public int sweep() {
        if (!properties.getRevalidation().isEnabled()) return 0;

        List<Alert> investigating = alertRepository.findWithAiByAiStatus(Alert.AiStatus.INVESTIGATING,
                PageRequest.of(0, properties.getRevalidation().getBatchSize()));
        Instant now = clock.instant();
        int handled = 0;

        for (Alert alert : investigating) {
            try {
                if (!alert.shouldRevalidate(now)) continue;

                int count = alert.getAi() != null ? alert.getAi().getInvestigationCount() : 0;
                int max = AlertLifecycleService.getMaxInvestigations(configResolver.resolve(alert.getCompanyId()));
                if (count >= max) {
                    revalidationService.completeAfterMaxInvestigations(alert.getId());
                } else {
                    eventPublisher.publishEvent(new AlertRevalidationDueEvent(alert.getId(), alert.getCompanyId(), count));
                }
                handled++;
            } catch (Exception e) {
                log.error("Revalidation sweep failed for alert {}: {}", alert.getId(), e.getMessage(), e);
            }
        }

        if (handled > 0) {
            log.info("Revalidation sweep handled {} of {} investigating alerts", handled, investigating.size());
        }
        return handled;
    }
}
