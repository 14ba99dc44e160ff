package com.example.policy.analyzer.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ContentQuality} as its lowercase code ({@code full}, {@code partial},
 * {@code title_only}).
 */
@Converter(autoApply = true)
public class ContentQualityConverter implements AttributeConverter<ContentQuality, String> {

    @Override
    public String convertToDatabaseColumn(ContentQuality quality) {
        return quality == null ? null : quality.getCode();
    }

    @Override
    public ContentQuality convertToEntityAttribute(String code) {
        return code == null ? null : ContentQuality.fromCode(code);
    }
}
