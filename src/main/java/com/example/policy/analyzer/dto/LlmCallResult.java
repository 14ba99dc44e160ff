package com.example.policy.analyzer.dto;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class LlmCallResult {

    private final boolean success;
    private final String text;
    private final String failureReason;
    private final int attempts;

    private LlmCallResult(boolean success, String text, String failureReason, int attempts) {
        this.success = success;
        this.text = text;
        this.failureReason = failureReason;
        this.attempts = attempts;
    }

    public static LlmCallResult success(String text, int attempts) {
        return new LlmCallResult(true, text, null, attempts);
    }

    public static LlmCallResult failure(String reason, int attempts) {
        return new LlmCallResult(false, null, reason, attempts);
    }
}
