package com.example.fleetsafety.repository;

import com.example.fleetsafety.domain.IncidentSignal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IncidentSignalRepository extends JpaRepository<IncidentSignal, String> {

    boolean existsByIncidentIdAndSignalId(String incidentId, String signalId);

    List<IncidentSignal> findByIncidentId(String incidentId);
}
