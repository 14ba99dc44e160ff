package com.example.policy.analyzer.controller;

import com.example.policy.analyzer.dto.AnalysisStatistics;
import com.example.policy.analyzer.dto.BatchSummary;
import com.example.policy.analyzer.dto.ClassificationResult;
import com.example.policy.analyzer.dto.IngestionSummary;
import com.example.policy.analyzer.dto.PolicyMatch;
import com.example.policy.analyzer.service.ConcurrentAnalysisRunner;
import com.example.policy.analyzer.service.LlmService;
import com.example.policy.analyzer.service.PolicyAnalysisService;
import com.example.policy.analyzer.service.PolicyIngestionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping(value = "/api/v1/policy-analysis")
@Slf4j
public class PolicyAnalysisController {

    @Autowired
    private PolicyAnalysisService policyAnalysisService;

    @Autowired
    private PolicyIngestionService policyIngestionService;

    @Autowired
    private LlmService llmService;

    @GetMapping(value = "/statistics")
    public ResponseEntity<AnalysisStatistics> getStatistics() {
        log.info("Statistics request received");
        return new ResponseEntity<>(policyAnalysisService.getStatistics(), HttpStatus.OK);
    }

    @GetMapping(value = "/policies/{policyId}")
    public ResponseEntity<ClassificationResult> getClassification(
            @PathVariable(value = "policyId") Long policyId) {
        log.info("Classification request received for policy {}", policyId);
        return policyAnalysisService.getClassification(policyId)
                .map(result -> new ResponseEntity<>(result, HttpStatus.OK))
                .orElseGet(() -> new ResponseEntity<>(HttpStatus.NOT_FOUND));
    }

    @GetMapping(value = "/search")
    public ResponseEntity<List<PolicyMatch>> searchByIndustry(@RequestParam(value = "industry") String industry) {
        log.info("Industry search request received for: {}", industry);
        return new ResponseEntity<>(policyAnalysisService.findByIndustryKeyword(industry), HttpStatus.OK);
    }

    @PostMapping(value = "/analyze")
    public ResponseEntity<ClassificationResult> analyzePolicy(@RequestBody Map<String, String> request) {
        String title = request.get("title");
        if (title == null || title.isBlank()) {
            return new ResponseEntity<>(HttpStatus.BAD_REQUEST);
        }
        log.info("Ad-hoc analysis request received for: {}", title);
        ClassificationResult result = policyAnalysisService.analyzePolicy(title, request.get("content"),
                request.get("eventType"), request.get("sourceUrl"));
        return new ResponseEntity<>(result, HttpStatus.OK);
    }

    @PostMapping(value = "/batch")
    public ResponseEntity<BatchSummary> analyzeBatch(
            @RequestParam(value = "limit", defaultValue = "10") int limit,
            @RequestParam(value = "deadlineSeconds", required = false) Long deadlineSeconds) {
        log.info("Batch analysis request received, limit {}", limit);
        if (!isValidDeadline(deadlineSeconds)) {
            return new ResponseEntity<>(HttpStatus.BAD_REQUEST);
        }
        return new ResponseEntity<>(policyAnalysisService.analyzeBatch(limit, toDeadline(deadlineSeconds)),
                HttpStatus.OK);
    }

    @PostMapping(value = "/batch-async")
    public CompletableFuture<ResponseEntity<BatchSummary>> analyzeBatchAsync(
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "maxConcurrent", defaultValue = "5") int maxConcurrent,
            @RequestParam(value = "deadlineSeconds", required = false) Long deadlineSeconds) {
        log.info("Async batch analysis request received, limit {}, concurrency {}", limit, maxConcurrent);
        if (maxConcurrent <= 0 || !isValidDeadline(deadlineSeconds)) {
            return CompletableFuture.completedFuture(new ResponseEntity<>(HttpStatus.BAD_REQUEST));
        }
        return policyAnalysisService.analyzeBatchAsync(limit, maxConcurrent, toDeadline(deadlineSeconds))
                .thenApply(summary -> new ResponseEntity<>(summary, HttpStatus.OK));
    }

    @PostMapping(value = "/reanalyze")
    public ResponseEntity<BatchSummary> reanalyze(
            @RequestParam(value = "limit", defaultValue = "10") int limit,
            @RequestParam(value = "storedContentOnly", defaultValue = "false") boolean storedContentOnly,
            @RequestParam(value = "deadlineSeconds", required = false) Long deadlineSeconds) {
        log.info("Re-analysis request received, limit {}, stored content only {}", limit, storedContentOnly);
        if (!isValidDeadline(deadlineSeconds)) {
            return new ResponseEntity<>(HttpStatus.BAD_REQUEST);
        }
        Duration deadline = toDeadline(deadlineSeconds);
        BatchSummary summary = storedContentOnly
                ? policyAnalysisService.reanalyzeFromStoredContent(limit, deadline)
                : policyAnalysisService.reanalyzeDegraded(limit, deadline);
        return new ResponseEntity<>(summary, HttpStatus.OK);
    }

    @PostMapping(value = "/ingest")
    public ResponseEntity<IngestionSummary> ingest(
            @RequestParam(value = "month", required = false) String month,
            @RequestParam(value = "maxPages", defaultValue = "10") int maxPages) {
        log.info("Ingestion request received, month {}, max pages {}", month, maxPages);
        YearMonth targetMonth;
        try {
            targetMonth = month == null || month.isBlank() ? null : YearMonth.parse(month);
        } catch (DateTimeParseException e) {
            log.warn("Invalid month parameter: {}", month);
            return new ResponseEntity<>(HttpStatus.BAD_REQUEST);
        }
        return new ResponseEntity<>(policyIngestionService.runDataCollection(targetMonth, maxPages), HttpStatus.OK);
    }

    @GetMapping(value = "/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean healthy = llmService.checkHealth();
        Map<String, Object> response = new HashMap<>();
        response.put("llmAvailable", healthy);
        return new ResponseEntity<>(response, healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE);
    }

    // deadlines are whole seconds within the runner's bound
    private static boolean isValidDeadline(Long deadlineSeconds) {
        return deadlineSeconds == null
                || (deadlineSeconds >= 0 && deadlineSeconds <= ConcurrentAnalysisRunner.MAX_DEADLINE.getSeconds());
    }

    private static Duration toDeadline(Long deadlineSeconds) {
        return deadlineSeconds == null ? null : Duration.ofSeconds(deadlineSeconds);
    }
}
