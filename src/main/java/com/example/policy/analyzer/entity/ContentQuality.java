package com.example.policy.analyzer.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much source text was available when the model was prompted.
 */
public enum ContentQuality {
    FULL("full"),
    PARTIAL("partial"),
    TITLE_ONLY("title_only");

    private final String code;

    ContentQuality(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ContentQuality fromCode(String code) {
        for (ContentQuality value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown content quality code: " + code);
    }
}
