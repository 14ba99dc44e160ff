package com.example.policy.analyzer.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity
@Data
@Table(name = "policy_analysis")
public class PolicyAnalysis {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "policy_id", nullable = false, unique = true)
    private Long policyId;

    // JSON array, e.g. ["新能源", "汽车"]
    @Column(name = "industries", length = 2000)
    private String industries;

    @Lob
    @Column(name = "analysis_summary", columnDefinition = "TEXT")
    private String analysisSummary;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "content_quality", length = 20)
    private ContentQuality contentQuality = ContentQuality.TITLE_ONLY;

    @Lob
    @Column(name = "full_content", columnDefinition = "TEXT")
    private String fullContent;

    @Column(name = "impact_type", length = 20)
    private String impactType;

    @Column(name = "analysis_status", length = 20, nullable = false)
    private AnalysisStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 20, nullable = false)
    private AnalysisOutcome outcome;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
