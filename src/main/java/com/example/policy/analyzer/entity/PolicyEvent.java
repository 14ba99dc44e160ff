package com.example.policy.analyzer.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Data
@NoArgsConstructor
@Table(name = "policy_events", indexes = {
        @Index(name = "idx_policy_events_title_url", columnList = "title, source_url"),
        @Index(name = "idx_policy_events_date", columnList = "date")
})
public class PolicyEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(nullable = false, length = 1000)
    private String title;

    @Column(name = "event_type")
    private String eventType;

    @Lob
    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(name = "source_url", length = 1000)
    private String sourceUrl;

    private String department;

    @Column(name = "policy_level")
    private String policyLevel;

    @Column(name = "impact_level")
    private String impactLevel;

    @Column(name = "content_type")
    private String contentType = "政策";

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
