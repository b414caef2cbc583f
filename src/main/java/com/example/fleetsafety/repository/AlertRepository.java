package com.example.fleetsafety.repository;

import com.example.fleetsafety.domain.Alert;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRepository extends JpaRepository<Alert, String> {

    /** Row lock for read-modify-write of the AI state and investigation counters. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Alert a WHERE a.id = :id")
    Optional<Alert> findByIdForUpdate(String id);

    @Query("SELECT a FROM Alert a LEFT JOIN FETCH a.ai WHERE a.aiStatus = :status ORDER BY a.updatedAt ASC")
    List<Alert> findWithAiByAiStatus(Alert.AiStatus status, Pageable pageable);

    @Query("SELECT a FROM Alert a WHERE a.attentionState = :state AND a.ackStatus = :ackStatus " +
           "AND a.nextEscalationAt IS NOT NULL AND a.nextEscalationAt <= :now ORDER BY a.nextEscalationAt ASC")
    List<Alert> findDueForEscalation(Alert.AttentionState state, Alert.AckStatus ackStatus,
                                     Instant now, Pageable pageable);

    boolean existsByCompanyIdAndSignal_SourceEventId(Long companyId, String sourceEventId);
}
