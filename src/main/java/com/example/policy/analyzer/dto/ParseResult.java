package com.example.policy.analyzer.dto;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Result of reading a model response: either the three required fields, or the reason they could
 * not be read.
 */
@Getter
@ToString
public class ParseResult {

    private final boolean ok;
    private final List<String> industries;
    private final String summary;
    private final double confidence;
    private final String impactType;
    private final String failureReason;

    private ParseResult(boolean ok, List<String> industries, String summary, double confidence,
            String impactType, String failureReason) {
        this.ok = ok;
        this.industries = industries;
        this.summary = summary;
        this.confidence = confidence;
        this.impactType = impactType;
        this.failureReason = failureReason;
    }

    public static ParseResult ok(List<String> industries, String summary, double confidence, String impactType) {
        return new ParseResult(true, List.copyOf(industries), summary, confidence, impactType, null);
    }

    public static ParseResult failed(String reason) {
        return new ParseResult(false, List.of(), null, 0.0, null, reason);
    }
}
