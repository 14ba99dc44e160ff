package com.example.policy.analyzer.source;

import com.example.policy.analyzer.entity.PolicyEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * CSRC publishes its policy list through a JSON search API rather than HTML.
 */
@Component
@Slf4j
public class CsrcPolicySource extends AbstractPolicySource {

    private static final String SITE_URL = "http://www.csrc.gov.cn";
    private static final String API_URL = SITE_URL + "/searchList/a1a078ee0bc54721ab6b148884c784a8"
            + "?_isAgg=true&_isJson=true&_pageSize=18&_template=index&page=%d";
    private static final int MIN_TITLE_LENGTH = 5;

    private final ObjectMapper objectMapper;

    public CsrcPolicySource(Clock clock, ObjectMapper objectMapper) {
        super(clock);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getSourceName() {
        return "csrc";
    }

    @Override
    public int getDefaultMaxPages() {
        return 50;
    }

    @Override
    public String pageUrl(int pageIndex) {
        return String.format(API_URL, pageIndex + 1);
    }

    @Override
    public List<PolicyEvent> extractCandidates(String rawPage, String pageUrl, YearMonth targetMonth) {
        JsonNode results;
        try {
            results = objectMapper.readTree(rawPage).path("data").path("results");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("CSRC page is not valid JSON: " + pageUrl, e);
        }
        if (!results.isArray()) {
            log.warn("CSRC page has an unexpected structure: {}", pageUrl);
            return List.of();
        }

        List<PolicyEvent> candidates = new ArrayList<>();
        for (JsonNode item : results) {
            String title = item.path("title").asText("").trim();
            if (title.length() < MIN_TITLE_LENGTH || ContentNoiseFilter.shouldSkipContent(title)) {
                continue;
            }
            LocalDate date = extractDate(item);
            if (!inTargetMonth(date, targetMonth)) {
                continue;
            }

            String content = item.path("content").asText("").trim();
            String memo = item.path("memo").asText("").trim();

            PolicyEvent event = new PolicyEvent();
            event.setDate(date);
            event.setTitle(title);
            event.setContent(content.isEmpty() ? memo : content);
            event.setSourceUrl(extractUrl(item));
            event.setEventType(PolicyAttributeClassifier.classifyCsrcPolicyType(title));
            event.setDepartment(extractDepartment(item));
            event.setPolicyLevel("国家级");
            event.setImpactLevel(PolicyAttributeClassifier.assessImpactLevel(title));
            candidates.add(event);
        }
        return candidates;
    }

    LocalDate extractDate(JsonNode item) {
        for (String field : List.of("publishedTimeStr", "publishTime", "createTime", "updateTime")) {
            LocalDate date = PolicyDateExtractor.findDate(item.path(field).asText(""));
            if (date != null) {
                return date;
            }
        }
        log.warn("No date found, using current date: {}",
                PolicyDateExtractor.abbreviate(item.path("title").asText("")));
        return today();
    }

    static String extractUrl(JsonNode item) {
        String url = item.path("url").asText("");
        if (url.startsWith("/")) {
            return SITE_URL + url;
        }
        if (url.startsWith("http")) {
            return url;
        }
        return SITE_URL;
    }

    static String extractDepartment(JsonNode item) {
        for (JsonNode domain : item.path("domainMetaList")) {
            for (JsonNode result : domain.path("resultList")) {
                if ("section".equals(result.path("key").asText()) || "部门".equals(result.path("name").asText())) {
                    String department = result.path("value").asText("").trim();
                    if (!department.isEmpty()) {
                        return department;
                    }
                }
            }
        }
        return "证监会";
    }
}
