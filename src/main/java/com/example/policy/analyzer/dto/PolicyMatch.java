package com.example.policy.analyzer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PolicyMatch {
    private Long id;
    private String title;
    private LocalDate date;
    private String eventType;
    private List<String> industries;
    private String analysisSummary;
}
