package com.example.policy.analyzer.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisStatus {
    SUCCESS("success"),
    FAILED("failed");

    private final String code;

    AnalysisStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AnalysisStatus fromCode(String code) {
        for (AnalysisStatus value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown analysis status code: " + code);
    }
}
