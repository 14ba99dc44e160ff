package com.example.policy.analyzer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AnalysisPrompt {
    private String text;
    /** True when the prompt carries the policy body rather than just title metadata. */
    private boolean rich;
}
