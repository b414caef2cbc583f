package com.example.fleetsafety.repository;

import com.example.fleetsafety.domain.AlertActivity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertActivityRepository extends JpaRepository<AlertActivity, String> {

    List<AlertActivity> findByAlertIdOrderByCreatedAtDesc(String alertId);

    long countByAlertIdAndAction(String alertId, AlertActivity.Action action);
}
