package com.example.policy.analyzer.scheduler;

import com.example.policy.analyzer.dto.AnalysisStatistics;
import com.example.policy.analyzer.dto.IngestionSummary;
import com.example.policy.analyzer.service.PolicyAnalysisService;
import com.example.policy.analyzer.service.PolicyIngestionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily policy update: collect new policies, then retry analyses that failed or came back empty.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "policy.scheduler.enabled", havingValue = "true")
public class PolicyUpdateScheduler {

    @Value("${policy.scheduler.max-pages:10}")
    private int maxPages = 10;

    @Value("${policy.scheduler.reanalyze-limit:20}")
    private int reanalyzeLimit = 20;

    private final PolicyIngestionService ingestionService;
    private final PolicyAnalysisService analysisService;

    public PolicyUpdateScheduler(PolicyIngestionService ingestionService, PolicyAnalysisService analysisService) {
        this.ingestionService = ingestionService;
        this.analysisService = analysisService;
    }

    @Scheduled(cron = "${policy.scheduler.cron:0 0 7 * * *}")
    public void runDailyUpdate() {
        log.info("Daily policy update started");
        try {
            IngestionSummary ingestion = ingestionService.runDataCollection(null, maxPages);
            log.info("Collected {} new policies, {} analyzed", ingestion.getSaved(), ingestion.getAnalyzed());

            if (reanalyzeLimit > 0) {
                analysisService.reanalyzeDegraded(reanalyzeLimit);
            }

            AnalysisStatistics stats = analysisService.getStatistics();
            log.info("Analysis coverage {}% ({} of {}), success rate {}%, {} need re-analysis",
                    stats.getAnalysisRate(), stats.getAnalyzedPolicies(), stats.getTotalPolicies(),
                    stats.getSuccessRate(), stats.getNeedsReanalysis());
        } catch (RuntimeException e) {
            log.error("Daily policy update failed", e);
        }
    }
}
