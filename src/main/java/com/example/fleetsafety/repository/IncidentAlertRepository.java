package com.example.fleetsafety.repository;

import com.example.fleetsafety.domain.IncidentAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IncidentAlertRepository extends JpaRepository<IncidentAlert, String> {

    boolean existsByIncidentIdAndAlertId(String incidentId, String alertId);

    List<IncidentAlert> findByIncidentId(String incidentId);

    List<IncidentAlert> findByAlertId(String alertId);
}
