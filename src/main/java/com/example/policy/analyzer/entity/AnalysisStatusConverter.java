package com.example.policy.analyzer.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AnalysisStatusConverter implements AttributeConverter<AnalysisStatus, String> {

    @Override
    public String convertToDatabaseColumn(AnalysisStatus status) {
        return status == null ? null : status.getCode();
    }

    @Override
    public AnalysisStatus convertToEntityAttribute(String code) {
        return code == null ? null : AnalysisStatus.fromCode(code);
    }
}
