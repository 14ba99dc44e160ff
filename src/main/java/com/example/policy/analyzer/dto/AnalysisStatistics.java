package com.example.policy.analyzer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisStatistics {
    private long totalPolicies;
    private long analyzedPolicies;
    private long unanalyzedPolicies;
    private long successfulAnalysis;
    private long failedAnalysis;
    private long noIndustryAnalysis;
    private long needsReanalysis;
    // percentages, two decimals
    private double analysisRate;
    private double successRate;
}
