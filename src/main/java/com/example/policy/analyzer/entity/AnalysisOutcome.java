package com.example.policy.analyzer.entity;

import java.util.List;

/**
 * Outcome of one classification. {@link #NO_INDUSTRY} is a successful analysis that found nothing,
 * {@link #FAILED} means the pipeline could not produce an analysis at all. Both are stored with a
 * sentinel in the industries column so older readers of the table keep working.
 */
public enum AnalysisOutcome {
    SUCCESS(null),
    NO_INDUSTRY("分析后无相关行业"),
    FAILED("分析失败");

    private final String sentinel;

    AnalysisOutcome(String sentinel) {
        this.sentinel = sentinel;
    }

    public String getSentinel() {
        return sentinel;
    }

    public List<String> sentinelIndustries() {
        return sentinel == null ? List.of() : List.of(sentinel);
    }

    public boolean needsReanalysis() {
        return this != SUCCESS;
    }

    public static boolean isSentinel(String industry) {
        return NO_INDUSTRY.sentinel.equals(industry) || FAILED.sentinel.equals(industry);
    }

    /**
     * Outcome for a result that arrived without one: a failed status is FAILED, no real industry
     * is NO_INDUSTRY, anything else SUCCESS.
     */
    public static AnalysisOutcome derive(AnalysisStatus status, List<String> industries) {
        if (status == AnalysisStatus.FAILED
                || (industries != null && industries.contains(FAILED.sentinel))) {
            return FAILED;
        }
        if (industries == null || industries.isEmpty() || industries.contains(NO_INDUSTRY.sentinel)) {
            return NO_INDUSTRY;
        }
        return SUCCESS;
    }
}
