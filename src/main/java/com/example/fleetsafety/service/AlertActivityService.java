package com.example.fleetsafety.service;

import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.AlertActivity;
import com.example.fleetsafety.repository.AlertActivityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Activity trail for alerts. Entries are written in the caller's transaction,
 * so a rolled-back state change leaves no activity behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertActivityService {

    private final AlertActivityRepository activityRepository;
    private final Clock clock;

    public AlertActivity logHumanAction(Alert alert, Long userId, AlertActivity.Action action,
                                        Map<String, Object> metadata) {
        return record(alert, AlertActivity.ActorType.HUMAN, userId, action, metadata);
    }

    public AlertActivity logAiAction(Alert alert, AlertActivity.Action action, Map<String, Object> metadata) {
        return record(alert, AlertActivity.ActorType.AI, null, action, metadata);
    }

    public AlertActivity logSystemAction(Alert alert, AlertActivity.Action action, Map<String, Object> metadata) {
        return record(alert, AlertActivity.ActorType.SYSTEM, null, action, metadata);
    }

    public List<AlertActivity> getForAlert(String alertId) {
        return activityRepository.findByAlertIdOrderByCreatedAtDesc(alertId);
    }

    public long countByAction(String alertId, AlertActivity.Action action) {
        return activityRepository.countByAlertIdAndAction(alertId, action);
    }

    private AlertActivity record(Alert alert, AlertActivity.ActorType actorType, Long userId,
                                 AlertActivity.Action action, Map<String, Object> metadata) {
        AlertActivity entry = AlertActivity.builder()
                .alertId(alert.getId())
                .companyId(alert.getCompanyId())
                .actorType(actorType)
                .userId(userId)
                .action(action)
                .metadata(metadata)
                .createdAt(clock.instant())
                .build();
        AlertActivity saved = activityRepository.save(entry);
        log.debug("Activity: [{}] {} on alert {}", actorType, action.value(), alert.getId());
        return saved;
    }
}
