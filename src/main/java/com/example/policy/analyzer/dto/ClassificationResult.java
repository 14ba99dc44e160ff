package com.example.policy.analyzer.dto;

import com.example.policy.analyzer.entity.AnalysisOutcome;
import com.example.policy.analyzer.entity.AnalysisStatus;
import com.example.policy.analyzer.entity.ContentQuality;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Classification of one policy record, as produced by the analysis pipeline and as read back
 * from the store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationResult {
    private Long policyId;
    private List<String> industries;
    private String summary;
    private double confidenceScore;
    private String impactType;
    private ContentQuality contentQuality;
    @JsonIgnore
    private String fullContent;
    private AnalysisStatus status;
    private AnalysisOutcome outcome;
    private LocalDateTime createdAt;

    public static ClassificationResult failed(String reason, ContentQuality quality, String fullContent) {
        return ClassificationResult.builder()
                .industries(AnalysisOutcome.FAILED.sentinelIndustries())
                .summary(reason)
                .confidenceScore(0.0)
                .contentQuality(quality)
                .fullContent(fullContent == null ? "" : fullContent)
                .status(AnalysisStatus.FAILED)
                .outcome(AnalysisOutcome.FAILED)
                .build();
    }
}
