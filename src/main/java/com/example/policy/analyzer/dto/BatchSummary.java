package com.example.policy.analyzer.dto;

import com.example.policy.analyzer.entity.AnalysisOutcome;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters for one batch run. {@code skipped} counts records that were selected but never started
 * because the batch deadline passed.
 */
@Data
@NoArgsConstructor
public class BatchSummary {
    private int selected;
    private int succeeded;
    private int noIndustry;
    private int failed;
    private int saved;
    private int notSaved;
    private int skipped;

    public void countOutcome(ClassificationResult result) {
        if (result.getOutcome() == AnalysisOutcome.SUCCESS) {
            succeeded++;
        } else if (result.getOutcome() == AnalysisOutcome.NO_INDUSTRY) {
            noIndustry++;
        } else {
            failed++;
        }
    }

    public void countPersisted(boolean persisted) {
        if (persisted) {
            saved++;
        } else {
            notSaved++;
        }
    }

    public void addSkipped(int count) {
        skipped += count;
    }
}
