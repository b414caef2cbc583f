package com.example.fleetsafety.repository;

import com.example.fleetsafety.domain.NotificationDecision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface NotificationDecisionRepository extends JpaRepository<NotificationDecision, String> {

    Optional<NotificationDecision> findFirstByAlertIdOrderBySequenceDesc(String alertId);

    List<NotificationDecision> findByAlertIdOrderBySequenceDesc(String alertId);

    long countByAlertId(String alertId);
}
