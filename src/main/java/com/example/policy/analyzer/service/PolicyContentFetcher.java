package com.example.policy.analyzer.service;

import com.example.policy.analyzer.source.ContentNoiseFilter;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.RetryBackoffSpec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches the full text of a policy from its source URL. Government sites publish either an HTML
 * article or a PDF attachment; both are reduced to plain text.
 */
@Service
@Slf4j
public class PolicyContentFetcher {

    static final int MIN_CONTENT_LENGTH = 200;
    private static final int MIN_LINE_LENGTH = 10;

    public static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

    // Government CMS editors (TRS_Editor, Custom_UnionStyle) first, generic containers last
    private static final List<String> CONTENT_SELECTORS = List.of(
            ".TRS_Editor", ".Custom_UnionStyle",
            ".content", ".article-content", ".policy-content", ".main-content",
            "#content", "#article-content", "#policy-content", "#main-content",
            ".text", ".article-text", ".policy-text",
            "article", ".article", ".post-content",
            "[class*=content]", "[class*=article]", "[class*=text]");

    @Value("${policy.content.timeout-ms:10000}")
    private int timeoutMs = 10000;

    private final RetryBackoffSpec retrySpec;

    public PolicyContentFetcher(@Qualifier("contentFetchRetrySpec") RetryBackoffSpec retrySpec) {
        this.retrySpec = retrySpec;
    }

    /**
     * Returns the policy text, or an empty string when the page could not be fetched or held too
     * little text to be useful. Never throws.
     */
    public String fetchContent(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            return "";
        }

        log.info("Fetching policy content from {}", sourceUrl);
        try {
            String text = Mono.fromCallable(RetrySpecs.withCallerMdc(() -> download(sourceUrl)))
                    .retryWhen(retrySpec)
                    .block();
            if (text == null) {
                text = "";
            }
            if (text.length() > MIN_CONTENT_LENGTH) {
                log.info("Fetched {} characters from {}", text.length(), sourceUrl);
                return text;
            }
            log.warn("Fetched content too short ({} characters): {}", text.length(), sourceUrl);
        } catch (RuntimeException e) {
            log.error("Error fetching policy content from {}: {}", sourceUrl, RetrySpecs.rootFailure(e).getMessage());
        }
        return "";
    }

    /**
     * Timeouts, resets and 5xx are transient; a 4xx answer will not change on retry.
     */
    public static boolean isTransient(Throwable error) {
        if (error instanceof HttpStatusException) {
            return ((HttpStatusException) error).getStatusCode() >= 500;
        }
        return error instanceof IOException;
    }

    protected String download(String sourceUrl) throws IOException {
        Connection.Response response = Jsoup.connect(sourceUrl)
                .header("User-Agent", USER_AGENT)
                .header("Accept-Language", "zh-CN,zh;q=0.9,en;q=0.8")
                .timeout(timeoutMs)
                .ignoreContentType(true)
                .maxBodySize(0)
                .followRedirects(true)
                .execute();

        String contentType = response.contentType();
        if (sourceUrl.toLowerCase().endsWith(".pdf") || (contentType != null && contentType.contains("pdf"))) {
            return extractPdfText(response.bodyAsBytes());
        }
        return extractMainText(response.parse());
    }

    static String extractPdfText(byte[] pdfBytes) throws IOException {
        try (PDDocument document = PDDocument.load(pdfBytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            return stripper.getText(document).trim();
        }
    }

    /**
     * Picks the first known article container holding enough text; otherwise falls back to the
     * body with navigation and boilerplate lines removed.
     */
    static String extractMainText(Document doc) {
        doc.select("script, style").remove();
        doc.select("br, p, div, li, tr, h1, h2, h3, h4, h5, h6").after("\n");

        for (String selector : CONTENT_SELECTORS) {
            Element element = doc.selectFirst(selector);
            if (element != null) {
                String text = element.wholeText().trim();
                if (text.length() > MIN_CONTENT_LENGTH) {
                    return normalizeLines(text, 0, false);
                }
            }
        }

        Element body = doc.body();
        if (body == null) {
            return "";
        }
        return normalizeLines(body.wholeText(), MIN_LINE_LENGTH, true);
    }

    private static String normalizeLines(String text, int minLineLength, boolean dropNavigation) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.length() <= minLineLength) {
                continue;
            }
            if (!dropNavigation || !ContentNoiseFilter.containsNavigationKeyword(trimmed)) {
                lines.add(trimmed);
            }
        }
        return String.join("\n", lines);
    }
}
