package com.example.fleetsafety.service;

import com.example.fleetsafety.domain.Alert;
import com.example.fleetsafety.domain.AlertActivity;
import com.example.fleetsafety.domain.AlertComment;
import com.example.fleetsafety.repository.AlertCommentRepository;
import com.example.fleetsafety.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Reviewer workflow, independent of the AI status. Any human status can be
 * set from any other; the value is validated before anything is written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HumanReviewService {

    private final AlertRepository alertRepository;
    private final AlertCommentRepository commentRepository;
    private final AlertActivityService activityService;
    private final Clock clock;

    @Transactional
    public Alert setHumanStatus(String alertId, String newStatus, Long actorUserId) {
        Alert.HumanStatus status = Alert.HumanStatus.fromValue(newStatus);
        Alert alert = alertRepository.findByIdForUpdate(alertId)
                .orElseThrow(() -> new IllegalArgumentException("Alert not found: " + alertId));

        Alert.HumanStatus previous = alert.getHumanStatus();
        alert.setHumanStatus(status);
        alert.setReviewedById(actorUserId);
        alert.setReviewedAt(clock.instant());
        Alert saved = alertRepository.save(alert);

        activityService.logHumanAction(saved, actorUserId, AlertActivity.Action.HUMAN_STATUS_CHANGED,
                Map.of("old_status", previous.value(), "new_status", status.value()));
        log.info("Alert {} human status {} -> {} by user {}", alertId, previous.value(), status.value(), actorUserId);
        return saved;
    }

    /** Comments are append-only. */
    @Transactional
    public AlertComment addComment(String alertId, Long userId, String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Comment content must not be empty");
        }
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new IllegalArgumentException("Alert not found: " + alertId));

        Instant now = clock.instant();
        AlertComment comment = commentRepository.save(AlertComment.builder()
                .alertId(alertId)
                .userId(userId)
                .content(content)
                .createdAt(now)
                .build());

        activityService.logHumanAction(alert, userId, AlertActivity.Action.COMMENT_ADDED,
                Map.of("comment_id", comment.getId()));
        return comment;
    }

    @Transactional(readOnly = true)
    public List<AlertComment> getComments(String alertId) {
        return commentRepository.findByAlertIdOrderByCreatedAtAsc(alertId);
    }
}
