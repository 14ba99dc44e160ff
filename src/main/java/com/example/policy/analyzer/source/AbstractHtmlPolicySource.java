package com.example.policy.analyzer.source;

import com.example.policy.analyzer.entity.PolicyEvent;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Listing pages that are plain HTML: every link with a policy-like title becomes a candidate.
 */
public abstract class AbstractHtmlPolicySource extends AbstractPolicySource {

    static final int MIN_LINK_TITLE_LENGTH = 10;

    protected AbstractHtmlPolicySource(Clock clock) {
        super(clock);
    }

    @Override
    public List<PolicyEvent> extractCandidates(String rawPage, String pageUrl, YearMonth targetMonth) {
        Document doc = Jsoup.parse(rawPage, pageUrl);
        LocalDate today = today();
        Set<String> seen = new HashSet<>();
        List<PolicyEvent> candidates = new ArrayList<>();

        for (Element link : doc.select("a[href]")) {
            String title = link.text().trim();
            if (ContentNoiseFilter.shouldSkipContent(title) || title.length() <= MIN_LINK_TITLE_LENGTH) {
                continue;
            }
            String url = link.absUrl("href");
            if (!url.startsWith("http") || !acceptCandidate(title, url)) {
                continue;
            }
            if (!seen.add(title + "|" + url)) {
                continue;
            }

            LocalDate date = PolicyDateExtractor.extract(link, url, title, today);
            if (!inTargetMonth(date, targetMonth)) {
                continue;
            }
            candidates.add(buildEvent(date, title, url));
        }
        return candidates;
    }

    protected boolean acceptCandidate(String title, String url) {
        return true;
    }

    protected abstract PolicyEvent buildEvent(LocalDate date, String title, String url);

    protected static PolicyEvent newEvent(LocalDate date, String title, String url) {
        PolicyEvent event = new PolicyEvent();
        event.setDate(date);
        event.setTitle(title);
        event.setSourceUrl(url);
        event.setImpactLevel(PolicyAttributeClassifier.assessImpactLevel(title));
        return event;
    }
}
