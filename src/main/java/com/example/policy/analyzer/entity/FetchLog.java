package com.example.policy.analyzer.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Data
@NoArgsConstructor
@Table(name = "fetch_log")
public class FetchLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_name", nullable = false, unique = true)
    private String sourceName;

    // Stored as text ("yyyy-MM-dd HH:mm:ss"); rows written by other tools may not parse
    @Column(name = "last_fetch_time", nullable = false)
    private String lastFetchTime;

    @Column(name = "fetch_status", nullable = false)
    private String fetchStatus = "success";

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "records_fetched")
    private Integer recordsFetched = 0;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
