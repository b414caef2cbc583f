package com.example.fleetsafety.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "alert_comments", indexes = {
        @Index(name = "idx_comment_alert", columnList = "alert_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertComment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "alert_id", nullable = false)
    private String alertId;

    @Column(name = "user_id")
    private Long userId;

    @Column(nullable = false, length = 4096)
    private String content;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
