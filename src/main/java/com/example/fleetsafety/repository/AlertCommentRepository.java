package com.example.fleetsafety.repository;

import com.example.fleetsafety.domain.AlertComment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertCommentRepository extends JpaRepository<AlertComment, String> {

    List<AlertComment> findByAlertIdOrderByCreatedAtAsc(String alertId);
}
