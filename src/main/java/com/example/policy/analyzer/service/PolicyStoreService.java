package com.example.policy.analyzer.service;

import com.example.policy.analyzer.dto.AnalysisStatistics;
import com.example.policy.analyzer.dto.ClassificationResult;
import com.example.policy.analyzer.dto.PolicyMatch;
import com.example.policy.analyzer.entity.AnalysisOutcome;
import com.example.policy.analyzer.entity.AnalysisStatus;
import com.example.policy.analyzer.entity.ContentQuality;
import com.example.policy.analyzer.entity.PolicyAnalysis;
import com.example.policy.analyzer.entity.PolicyEvent;
import com.example.policy.analyzer.repository.PolicyAnalysisRepository;
import com.example.policy.analyzer.repository.PolicyEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes policy records and their classifications. The industries column holds a JSON
 * array; sentinel values mark failed and empty analyses.
 */
@Service
@Slf4j
public class PolicyStoreService {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {
    };

    private final PolicyEventRepository policyEventRepository;
    private final PolicyAnalysisRepository policyAnalysisRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PolicyStoreService(PolicyEventRepository policyEventRepository,
            PolicyAnalysisRepository policyAnalysisRepository, ObjectMapper objectMapper, Clock clock) {
        this.policyEventRepository = policyEventRepository;
        this.policyAnalysisRepository = policyAnalysisRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Inserts the classification for {@code policyId}, or replaces the existing one, and stamps
     * it with the current time.
     */
    public void upsertResult(Long policyId, ClassificationResult result) {
        PolicyAnalysis analysis = policyAnalysisRepository.findByPolicyId(policyId).orElseGet(PolicyAnalysis::new);
        boolean update = analysis.getId() != null;

        analysis.setPolicyId(policyId);
        analysis.setIndustries(writeIndustries(result.getIndustries()));
        analysis.setAnalysisSummary(result.getSummary());
        analysis.setConfidenceScore(result.getConfidenceScore());
        analysis.setContentQuality(result.getContentQuality() == null ? ContentQuality.TITLE_ONLY
                : result.getContentQuality());
        analysis.setFullContent(result.getFullContent() == null ? "" : result.getFullContent());
        analysis.setImpactType(result.getImpactType());
        AnalysisOutcome outcome = result.getOutcome() != null ? result.getOutcome()
                : AnalysisOutcome.derive(result.getStatus(), result.getIndustries());
        analysis.setStatus(result.getStatus() != null ? result.getStatus()
                : outcome == AnalysisOutcome.FAILED ? AnalysisStatus.FAILED : AnalysisStatus.SUCCESS);
        analysis.setOutcome(outcome);
        analysis.setCreatedAt(LocalDateTime.now(clock));
        policyAnalysisRepository.save(analysis);

        log.info("{} analysis for policy {} ({})", update ? "Updated" : "Saved", policyId, outcome);
    }

    /**
     * Same as {@link #upsertResult} but reports store failures as {@code false}.
     */
    public boolean saveResult(Long policyId, ClassificationResult result) {
        try {
            upsertResult(policyId, result);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to save analysis for policy {}: {}", policyId, e.getMessage());
            return false;
        }
    }

    public Optional<ClassificationResult> getClassification(Long policyId) {
        return policyAnalysisRepository.findByPolicyId(policyId).map(this::toResult);
    }

    /**
     * Stored cached page text for a policy, if an earlier analysis fetched any.
     */
    public Optional<String> getStoredContent(Long policyId) {
        return policyAnalysisRepository.findByPolicyId(policyId)
                .map(PolicyAnalysis::getFullContent)
                .filter(content -> !content.isEmpty());
    }

    /**
     * Policies whose industry list contains {@code keyword}, newest first. Failed and empty
     * analyses never match.
     */
    public List<PolicyMatch> findByIndustryKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return List.of();
        }

        Map<Long, PolicyAnalysis> analyses = new HashMap<>();
        for (PolicyAnalysis analysis : policyAnalysisRepository.findByOutcomeAndIndustriesContaining(
                AnalysisOutcome.SUCCESS, keyword)) {
            List<String> industries = readIndustries(analysis.getIndustries());
            boolean matches = industries.stream()
                    .anyMatch(industry -> !AnalysisOutcome.isSentinel(industry) && industry.contains(keyword));
            if (matches) {
                analyses.put(analysis.getPolicyId(), analysis);
            }
        }

        List<PolicyMatch> matches = new ArrayList<>();
        for (PolicyEvent event : policyEventRepository.findAllById(analyses.keySet())) {
            PolicyAnalysis analysis = analyses.get(event.getId());
            matches.add(new PolicyMatch(event.getId(), event.getTitle(), event.getDate(), event.getEventType(),
                    readIndustries(analysis.getIndustries()), analysis.getAnalysisSummary()));
        }
        matches.sort(Comparator.comparing(PolicyMatch::getDate, Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(PolicyMatch::getId, Comparator.reverseOrder()));
        return matches;
    }

    public AnalysisStatistics getStatistics() {
        long total = policyEventRepository.count();
        long analyzed = policyAnalysisRepository.count();
        long successful = policyAnalysisRepository.countByOutcome(AnalysisOutcome.SUCCESS);
        long failed = policyAnalysisRepository.countByOutcome(AnalysisOutcome.FAILED);
        long noIndustry = policyAnalysisRepository.countByOutcome(AnalysisOutcome.NO_INDUSTRY);

        return AnalysisStatistics.builder()
                .totalPolicies(total)
                .analyzedPolicies(analyzed)
                .unanalyzedPolicies(total - analyzed)
                .successfulAnalysis(successful)
                .failedAnalysis(failed)
                .noIndustryAnalysis(noIndustry)
                .needsReanalysis(failed + noIndustry)
                .analysisRate(percentage(analyzed, total))
                .successRate(percentage(successful, analyzed))
                .build();
    }

    public List<PolicyEvent> findUnanalyzed(int limit) {
        return policyEventRepository.findUnanalyzed(PageRequest.of(0, limit));
    }

    public List<PolicyEvent> findDegraded(int limit) {
        return policyEventRepository.findByAnalysisOutcomeIn(
                List.of(AnalysisOutcome.FAILED, AnalysisOutcome.NO_INDUSTRY), PageRequest.of(0, limit));
    }

    public List<PolicyEvent> findWithStoredContent(int limit) {
        return policyEventRepository.findWithStoredContent(PageRequest.of(0, limit));
    }

    /**
     * Saves each record on its own; a record the store rejects is logged and skipped.
     *
     * @return number of records saved
     */
    public int savePolicies(List<PolicyEvent> policies) {
        if (policies == null || policies.isEmpty()) {
            log.info("No new policies to save");
            return 0;
        }
        int saved = 0;
        for (PolicyEvent policy : policies) {
            try {
                policyEventRepository.save(policy);
                saved++;
            } catch (RuntimeException e) {
                log.error("Error saving policy '{}': {}", policy.getTitle(), e.getMessage());
            }
        }
        log.info("Saved {} of {} policies", saved, policies.size());
        return saved;
    }

    ClassificationResult toResult(PolicyAnalysis analysis) {
        return ClassificationResult.builder()
                .policyId(analysis.getPolicyId())
                .industries(readIndustries(analysis.getIndustries()))
                .summary(analysis.getAnalysisSummary())
                .confidenceScore(analysis.getConfidenceScore() == null ? 0.0 : analysis.getConfidenceScore())
                .impactType(analysis.getImpactType())
                .contentQuality(analysis.getContentQuality() == null ? ContentQuality.TITLE_ONLY
                        : analysis.getContentQuality())
                .fullContent(analysis.getFullContent())
                .status(analysis.getStatus() == null ? AnalysisStatus.SUCCESS : analysis.getStatus())
                .outcome(analysis.getOutcome())
                .createdAt(analysis.getCreatedAt())
                .build();
    }

    private String writeIndustries(List<String> industries) {
        try {
            return objectMapper.writeValueAsString(industries == null ? List.of() : industries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize industries " + industries, e);
        }
    }

    private List<String> readIndustries(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable industries column: {}", json);
            return List.of();
        }
    }

    static double percentage(long part, long whole) {
        if (whole == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100.0 / whole).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
