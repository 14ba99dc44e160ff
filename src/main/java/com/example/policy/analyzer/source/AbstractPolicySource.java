package com.example.policy.analyzer.source;

import com.example.policy.analyzer.entity.PolicyEvent;
import com.example.policy.analyzer.service.PolicyContentFetcher;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Value;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Pagination shared by all sources. A page that fails is logged and counted as empty; three
 * empty pages in a row, or a 404, end the walk.
 */
@Slf4j
public abstract class AbstractPolicySource implements PolicySource {

    static final int MAX_CONSECUTIVE_EMPTY_PAGES = 3;

    @Value("${policy.source.page-delay-ms:1000}")
    private long pageDelayMs = 1000;

    @Value("${policy.source.timeout-ms:10000}")
    private int timeoutMs = 10000;

    @Value("${policy.source.min-interval-hours:1}")
    private int minIntervalHours = 1;

    protected final Clock clock;

    protected AbstractPolicySource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int getMinIntervalHours() {
        return minIntervalHours;
    }

    @Override
    public int getDefaultMaxPages() {
        return 10;
    }

    @Override
    public String fetchSourcePage(String url) throws IOException {
        return Jsoup.connect(url)
                .header("User-Agent", PolicyContentFetcher.USER_AGENT)
                .header("Accept-Language", "zh-CN,zh;q=0.9,en;q=0.8")
                .timeout(timeoutMs)
                .ignoreContentType(true)
                .maxBodySize(0)
                .execute()
                .body();
    }

    @Override
    public List<PolicyEvent> fetchPolicies(YearMonth targetMonth, int maxPages) throws IOException {
        int pages = maxPages > 0 ? maxPages : getDefaultMaxPages();
        log.info("Fetching {} policies, up to {} pages, target month {}", getSourceName(), pages,
                targetMonth == null ? "any" : targetMonth);

        List<PolicyEvent> policies = new ArrayList<>();
        int emptyPages = 0;
        int attemptedPages = 0;
        int failedPages = 0;
        IOException lastError = null;

        for (int pageIndex = 0; pageIndex < pages; pageIndex++) {
            String url = pageUrl(pageIndex);
            attemptedPages++;
            List<PolicyEvent> found = List.of();
            try {
                found = extractCandidates(fetchSourcePage(url), url, targetMonth);
                log.info("{} page {} yielded {} policies", getSourceName(), pageIndex + 1, found.size());
            } catch (HttpStatusException e) {
                if (e.getStatusCode() == 404) {
                    log.info("{} page {} not found, stopping: {}", getSourceName(), pageIndex + 1, url);
                    break;
                }
                failedPages++;
                lastError = e;
                log.warn("{} page {} returned status {}", getSourceName(), pageIndex + 1, e.getStatusCode());
            } catch (IOException e) {
                failedPages++;
                lastError = e;
                log.error("Error fetching {} page {}: {}", getSourceName(), pageIndex + 1, e.getMessage());
            } catch (RuntimeException e) {
                failedPages++;
                log.error("Error extracting {} page {}", getSourceName(), pageIndex + 1, e);
            }

            if (found.isEmpty()) {
                emptyPages++;
                if (emptyPages >= MAX_CONSECUTIVE_EMPTY_PAGES) {
                    log.info("{}: {} consecutive pages without policies, stopping", getSourceName(), emptyPages);
                    break;
                }
            } else {
                emptyPages = 0;
                policies.addAll(found);
            }

            if (!pause()) {
                break;
            }
        }

        if (attemptedPages > 0 && failedPages == attemptedPages) {
            String message = "All " + attemptedPages + " pages failed for " + getSourceName();
            throw lastError == null ? new IOException(message) : new IOException(message, lastError);
        }
        log.info("{} fetched {} policies in total", getSourceName(), policies.size());
        return policies;
    }

    protected LocalDate today() {
        return LocalDate.now(clock);
    }

    protected static boolean inTargetMonth(LocalDate date, YearMonth targetMonth) {
        return targetMonth == null || YearMonth.from(date).equals(targetMonth);
    }

    private boolean pause() {
        if (pageDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(pageDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} pagination interrupted", getSourceName());
            return false;
        }
    }
}
