package com.example.policy.analyzer.service;

import com.example.policy.analyzer.dto.BatchSummary;
import com.example.policy.analyzer.dto.IngestionSummary;
import com.example.policy.analyzer.entity.PolicyEvent;
import com.example.policy.analyzer.source.PolicySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * One collection run: every source that is not throttled is fetched, the merged candidates are
 * deduplicated against the store and saved, and fresh records are optionally analyzed right away.
 */
@Service
@Slf4j
public class PolicyIngestionService {

    static final int ASYNC_THRESHOLD = 5;
    static final int INGESTION_CONCURRENCY = 3;

    @Value("${policy.ingestion.auto-analyze:true}")
    private boolean autoAnalyze = true;

    private final List<PolicySource> sources;
    private final FetchThrottleService throttleService;
    private final PolicyDeduplicationService deduplicationService;
    private final PolicyStoreService storeService;
    private final PolicyAnalysisService analysisService;

    public PolicyIngestionService(List<PolicySource> sources, FetchThrottleService throttleService,
            PolicyDeduplicationService deduplicationService, PolicyStoreService storeService,
            PolicyAnalysisService analysisService) {
        this.sources = sources;
        this.throttleService = throttleService;
        this.deduplicationService = deduplicationService;
        this.storeService = storeService;
        this.analysisService = analysisService;
    }

    /**
     * @param targetMonth only keep policies published in this month; null keeps everything
     * @param maxPages    listing pages per source; zero or less uses each source's default
     */
    public IngestionSummary runDataCollection(YearMonth targetMonth, int maxPages) {
        log.info("Starting policy collection, target month {}, max pages {}",
                targetMonth == null ? "any" : targetMonth, maxPages);
        IngestionSummary summary = new IngestionSummary();

        List<PolicyEvent> all = new ArrayList<>();
        for (PolicySource source : sources) {
            String name = source.getSourceName();
            if (throttleService.shouldSkip(name, source.getMinIntervalHours())) {
                summary.getPerSource().put(name, -1);
                continue;
            }
            try {
                List<PolicyEvent> fetched = source.fetchPolicies(targetMonth, maxPages);
                throttleService.recordStatus(name, FetchThrottleService.STATUS_SUCCESS, fetched.size(), null);
                summary.getPerSource().put(name, fetched.size());
                all.addAll(fetched);
            } catch (IOException | RuntimeException e) {
                log.error("Error fetching policies from {}: {}", name, e.getMessage());
                throttleService.recordStatus(name, FetchThrottleService.STATUS_ERROR, 0, e.getMessage());
                summary.getPerSource().put(name, 0);
            }
        }

        List<PolicyEvent> unique = PolicyDeduplicationService.collapseDuplicates(all);
        List<PolicyEvent> fresh = deduplicationService.filterNew(unique);
        int saved = storeService.savePolicies(fresh);

        summary.setFetched(all.size());
        summary.setUnique(unique.size());
        summary.setNewRecords(fresh.size());
        summary.setSaved(saved);
        log.info("Collection finished: fetched {}, unique {}, new {}, saved {}", all.size(), unique.size(),
                fresh.size(), saved);

        if (saved > 0 && autoAnalyze) {
            summary.setAnalyzed(analyzeFresh(saved));
        }
        return summary;
    }

    private int analyzeFresh(int saved) {
        try {
            BatchSummary batch;
            if (saved >= ASYNC_THRESHOLD) {
                batch = analysisService.analyzeBatchAsync(saved + ASYNC_THRESHOLD, INGESTION_CONCURRENCY).get();
            } else {
                batch = analysisService.analyzeBatch(saved);
            }
            log.info("Automatic analysis finished: {} of {} policies succeeded", batch.getSucceeded(),
                    batch.getSelected());
            return batch.getSucceeded();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Automatic analysis interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.error("Automatic analysis failed", e);
        }
        return 0;
    }
}
