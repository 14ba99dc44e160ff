package com.example.policy.analyzer.service;

import com.example.policy.analyzer.dto.AnalysisPrompt;
import com.example.policy.analyzer.dto.AnalysisStatistics;
import com.example.policy.analyzer.dto.BatchSummary;
import com.example.policy.analyzer.dto.ClassificationResult;
import com.example.policy.analyzer.dto.LlmCallResult;
import com.example.policy.analyzer.dto.ParseResult;
import com.example.policy.analyzer.dto.PolicyMatch;
import com.example.policy.analyzer.entity.AnalysisOutcome;
import com.example.policy.analyzer.entity.AnalysisStatus;
import com.example.policy.analyzer.entity.ContentQuality;
import com.example.policy.analyzer.entity.PolicyEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Classifies policy records with the LLM: resolves the policy text, picks a prompt for its
 * quality, calls the model and turns the reply into a {@link ClassificationResult}. A single
 * record never fails a batch; anything that goes wrong becomes a FAILED result.
 */
@Service
@Slf4j
public class PolicyAnalysisService {

    static final String CALL_FAILED_REASON = "API调用失败，无法进行分析";
    static final String PARSE_FAILED_REASON = "AI返回结果解析失败";
    static final String UNEXPECTED_ERROR_REASON = "分析过程异常";

    @Value("${policy.analysis.batch-delay-ms:800}")
    private long batchDelayMs = 800;

    @Value("${policy.analysis.reanalysis-delay-ms:500}")
    private long reanalysisDelayMs = 500;

    private final PolicyContentFetcher contentFetcher;
    private final PromptBuilder promptBuilder;
    private final LlmService llmService;
    private final AnalysisResponseParser responseParser;
    private final PolicyStoreService storeService;
    private final ConcurrentAnalysisRunner runner;

    public PolicyAnalysisService(PolicyContentFetcher contentFetcher, PromptBuilder promptBuilder,
            LlmService llmService, AnalysisResponseParser responseParser, PolicyStoreService storeService,
            ConcurrentAnalysisRunner runner) {
        this.contentFetcher = contentFetcher;
        this.promptBuilder = promptBuilder;
        this.llmService = llmService;
        this.responseParser = responseParser;
        this.storeService = storeService;
        this.runner = runner;
    }

    /**
     * Ad-hoc analysis of a policy that is not (necessarily) stored. Nothing is persisted.
     */
    public ClassificationResult analyzePolicy(String title, String content, String eventType, String sourceUrl) {
        return analyze(null, title, content, eventType, sourceUrl);
    }

    public ClassificationResult analyzeRecord(PolicyEvent event) {
        return analyze(event.getId(), event.getTitle(), event.getContent(), event.getEventType(),
                event.getSourceUrl());
    }

    /**
     * Analyzes the newest unclassified records one at a time, persisting each result before
     * moving on.
     */
    public BatchSummary analyzeBatch(int limit) {
        return analyzeBatch(limit, null);
    }

    /**
     * @param deadline time after which no further record is started; null for none
     */
    public BatchSummary analyzeBatch(int limit, Duration deadline) {
        ConcurrentAnalysisRunner.checkDeadline(deadline);
        List<PolicyEvent> events = storeService.findUnanalyzed(limit);
        log.info("Analyzing {} unclassified policies", events.size());
        return runSequential(events, batchDelayMs, deadline, this::analyzeRecord);
    }

    public CompletableFuture<BatchSummary> analyzeBatchAsync(int limit, int maxConcurrent) {
        return analyzeBatchAsync(limit, maxConcurrent, null);
    }

    /**
     * Analyzes the newest unclassified records with {@code maxConcurrent} workers. Results are
     * written by a single pass once every worker has stopped.
     *
     * @param deadline time after which workers stop taking new records; null for none
     */
    public CompletableFuture<BatchSummary> analyzeBatchAsync(int limit, int maxConcurrent, Duration deadline) {
        ConcurrentAnalysisRunner.checkDeadline(deadline);
        List<PolicyEvent> events = storeService.findUnanalyzed(limit);
        log.info("Analyzing {} unclassified policies with concurrency {}", events.size(), maxConcurrent);

        return runner.run(events, maxConcurrent, deadline, this::analyzeRecord, event -> String.valueOf(event.getId()))
                .thenApply(report -> {
                    BatchSummary summary = new BatchSummary();
                    summary.setSelected(events.size());
                    for (ClassificationResult result : report.getResults()) {
                        summary.countOutcome(result);
                        summary.countPersisted(storeService.saveResult(result.getPolicyId(), result));
                    }
                    for (int i = 0; i < report.getErrors(); i++) {
                        summary.countOutcome(ClassificationResult.failed(UNEXPECTED_ERROR_REASON,
                                ContentQuality.TITLE_ONLY, ""));
                        summary.countPersisted(false);
                    }
                    summary.addSkipped(report.getSkipped());
                    log.info("Async analysis finished: {}", summary);
                    return summary;
                });
    }

    /**
     * Re-runs records whose last analysis failed or found no industry. Page text cached by the
     * earlier attempt is reused instead of fetching the source again.
     */
    public BatchSummary reanalyzeDegraded(int limit) {
        return reanalyzeDegraded(limit, null);
    }

    public BatchSummary reanalyzeDegraded(int limit, Duration deadline) {
        ConcurrentAnalysisRunner.checkDeadline(deadline);
        List<PolicyEvent> events = storeService.findDegraded(limit);
        log.info("Re-analyzing {} failed or empty analyses", events.size());
        return runSequential(events, batchDelayMs, deadline, event -> {
            Optional<String> cached = storeService.getStoredContent(event.getId());
            if (cached.isPresent()) {
                return analyze(event.getId(), event.getTitle(), cached.get(), event.getEventType(),
                        event.getSourceUrl());
            }
            return analyzeRecord(event);
        });
    }

    public BatchSummary reanalyzeFromStoredContent(int limit) {
        return reanalyzeFromStoredContent(limit, null);
    }

    public BatchSummary reanalyzeFromStoredContent(int limit, Duration deadline) {
        ConcurrentAnalysisRunner.checkDeadline(deadline);
        List<PolicyEvent> events = storeService.findWithStoredContent(limit);
        log.info("Re-analyzing {} policies from stored content", events.size());
        return runSequential(events, reanalysisDelayMs, deadline, event -> {
            String cached = storeService.getStoredContent(event.getId()).orElse("");
            return analyze(event.getId(), event.getTitle(), cached, event.getEventType(), "");
        });
    }

    public Optional<ClassificationResult> getClassification(Long policyId) {
        return storeService.getClassification(policyId);
    }

    public List<PolicyMatch> findByIndustryKeyword(String keyword) {
        return storeService.findByIndustryKeyword(keyword);
    }

    public AnalysisStatistics getStatistics() {
        return storeService.getStatistics();
    }

    private BatchSummary runSequential(List<PolicyEvent> events, long delayMs, Duration deadline,
            Function<PolicyEvent, ClassificationResult> task) {
        BatchSummary summary = new BatchSummary();
        summary.setSelected(events.size());
        long deadlineNanos = deadline == null ? 0 : System.nanoTime() + deadline.toNanos();

        for (int i = 0; i < events.size(); i++) {
            if (deadline != null && System.nanoTime() - deadlineNanos >= 0) {
                log.warn("Deadline reached, {} policies left unprocessed", events.size() - i);
                summary.addSkipped(events.size() - i);
                break;
            }
            PolicyEvent event = events.get(i);
            MDC.put(ConcurrentAnalysisRunner.MDC_KEY, String.valueOf(event.getId()));
            try {
                ClassificationResult result = task.apply(event);
                summary.countOutcome(result);
                summary.countPersisted(storeService.saveResult(event.getId(), result));
            } finally {
                MDC.remove(ConcurrentAnalysisRunner.MDC_KEY);
            }

            if (i < events.size() - 1 && delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Batch interrupted, {} policies left unprocessed", events.size() - i - 1);
                    summary.addSkipped(events.size() - i - 1);
                    break;
                }
            }
        }
        log.info("Batch analysis finished: {}", summary);
        return summary;
    }

    private ClassificationResult analyze(Long policyId, String title, String content, String eventType,
            String sourceUrl) {
        String resolved = "";
        ContentQuality quality = ContentQuality.TITLE_ONLY;
        try {
            resolved = resolveContent(content, sourceUrl);
            quality = ContentQualityClassifier.classify(resolved);
            AnalysisPrompt prompt = promptBuilder.build(title, resolved, eventType, sourceUrl);
            log.info("Analyzing policy: {} (quality {}, {} prompt)", abbreviate(title), quality.getCode(),
                    prompt.isRich() ? "rich" : "sparse");

            LlmCallResult call = llmService.complete(prompt.getText());
            if (!call.isSuccess()) {
                log.warn("LLM call failed after {} attempts for {}: {}", call.getAttempts(), abbreviate(title),
                        call.getFailureReason());
                return withPolicyId(ClassificationResult.failed(CALL_FAILED_REASON, quality, resolved), policyId);
            }

            ParseResult parsed = responseParser.parse(call.getText());
            if (!parsed.isOk()) {
                log.warn("Could not parse LLM response for {}: {}", abbreviate(title), parsed.getFailureReason());
                return withPolicyId(ClassificationResult.failed(PARSE_FAILED_REASON, quality, resolved), policyId);
            }

            AnalysisOutcome outcome = parsed.getIndustries().isEmpty()
                    ? AnalysisOutcome.NO_INDUSTRY : AnalysisOutcome.SUCCESS;
            ClassificationResult result = ClassificationResult.builder()
                    .policyId(policyId)
                    .industries(outcome == AnalysisOutcome.SUCCESS ? parsed.getIndustries()
                            : outcome.sentinelIndustries())
                    .summary(parsed.getSummary())
                    .confidenceScore(parsed.getConfidence())
                    .impactType(parsed.getImpactType())
                    .contentQuality(quality)
                    .fullContent(resolved)
                    .status(AnalysisStatus.SUCCESS)
                    .outcome(outcome)
                    .build();
            log.info("Policy analyzed: {}, industries {}", abbreviate(title), result.getIndustries());
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected error analyzing policy {}", abbreviate(title), e);
            return withPolicyId(ClassificationResult.failed(UNEXPECTED_ERROR_REASON + ": " + e.getMessage(),
                    quality, resolved), policyId);
        }
    }

    /**
     * Inline content wins; otherwise the source page is fetched. An empty string means only the
     * title is available.
     */
    private String resolveContent(String content, String sourceUrl) {
        if (content != null && !content.isBlank()) {
            return content;
        }
        if (sourceUrl != null && !sourceUrl.isBlank()) {
            return contentFetcher.fetchContent(sourceUrl);
        }
        return "";
    }

    private static ClassificationResult withPolicyId(ClassificationResult result, Long policyId) {
        result.setPolicyId(policyId);
        return result;
    }

    private static String abbreviate(String title) {
        if (title == null) {
            return "";
        }
        return title.length() > 50 ? title.substring(0, 50) + "..." : title;
    }
}
