package com.example.policy.analyzer.service;

import com.example.policy.analyzer.entity.ContentQuality;

public final class ContentQualityClassifier {

    public static final int FULL_CONTENT_THRESHOLD = 500;
    public static final int PARTIAL_CONTENT_THRESHOLD = 100;

    private ContentQualityClassifier() {
    }

    /**
     * Buckets text by length: more than 500 characters is {@code full}, more than 100 is
     * {@code partial}, anything else (including null) is {@code title_only}.
     */
    public static ContentQuality classify(String text) {
        int length = text == null ? 0 : text.length();
        if (length > FULL_CONTENT_THRESHOLD) {
            return ContentQuality.FULL;
        }
        if (length > PARTIAL_CONTENT_THRESHOLD) {
            return ContentQuality.PARTIAL;
        }
        return ContentQuality.TITLE_ONLY;
    }
}
