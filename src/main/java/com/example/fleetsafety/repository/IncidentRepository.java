package com.example.fleetsafety.repository;

import com.example.fleetsafety.domain.Incident;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IncidentRepository extends JpaRepository<Incident, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Incident i WHERE i.id = :id")
    Optional<Incident> findByIdForUpdate(String id);

    Optional<Incident> findFirstByCompanyIdAndSourceEventId(Long companyId, String sourceEventId);

    Optional<Incident> findFirstByCompanyIdAndDedupeKey(Long companyId, String dedupeKey);

    List<Incident> findByCompanyIdAndStatusIn(Long companyId, List<Incident.IncidentStatus> statuses);
}
