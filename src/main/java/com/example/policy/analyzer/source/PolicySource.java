package com.example.policy.analyzer.source;

import com.example.policy.analyzer.entity.PolicyEvent;

import java.io.IOException;
import java.time.YearMonth;
import java.util.List;

/**
 * One government site that publishes policy listings. Implementations are Spring beans; the
 * ingestion service picks up every registered source.
 */
public interface PolicySource {

    /**
     * Stable key used in the fetch log, e.g. {@code gov_cn}.
     */
    String getSourceName();

    int getMinIntervalHours();

    int getDefaultMaxPages();

    /**
     * URL of the listing page at {@code pageIndex}, counting from zero.
     */
    String pageUrl(int pageIndex);

    String fetchSourcePage(String url) throws IOException;

    List<PolicyEvent> extractCandidates(String rawPage, String pageUrl, YearMonth targetMonth);

    /**
     * Walks up to {@code maxPages} listing pages and returns the candidates found, restricted to
     * {@code targetMonth} when it is not null.
     *
     * @throws IOException when not a single page could be fetched
     */
    List<PolicyEvent> fetchPolicies(YearMonth targetMonth, int maxPages) throws IOException;
}
