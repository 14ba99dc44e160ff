package com.example.policy.analyzer.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
public class IngestionSummary {
    private int fetched;
    private int unique;
    private int newRecords;
    private int saved;
    private int analyzed;
    // per source: records fetched, or -1 when throttled
    private Map<String, Integer> perSource = new LinkedHashMap<>();
}
