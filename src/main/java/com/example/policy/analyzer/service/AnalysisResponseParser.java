package com.example.policy.analyzer.service;

import com.example.policy.analyzer.dto.ParseResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the analysis object out of free-form model output. The model is asked for bare JSON but
 * often wraps it in prose or markdown fences, so the first balanced {...} block is taken.
 */
@Service
@Slf4j
public class AnalysisResponseParser {

    static final double DEFAULT_CONFIDENCE = 0.5;
    // matches the "at most 5 industries" asked for in the prompt and keeps the stored JSON short
    static final int MAX_INDUSTRIES = 5;
    static final int MAX_INDUSTRY_LENGTH = 50;
    private static final int LOG_SNIPPET_LENGTH = 500;

    private static final String[] SUMMARY_FIELDS = { "analysis_summary", "summary" };
    private static final String[] CONFIDENCE_FIELDS = { "confidence_score", "confidenceScore" };

    private final ObjectMapper lenientMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    public ParseResult parse(String response) {
        if (response == null || response.isBlank()) {
            log.error("Model returned an empty response");
            return ParseResult.failed("empty response");
        }

        Optional<String> json = extractJsonObject(response);
        if (json.isEmpty()) {
            log.error("No balanced JSON object in model response: {}", truncate(response));
            return ParseResult.failed("no balanced JSON object in response");
        }

        JsonNode root;
        try {
            root = lenientMapper.readTree(json.get());
        } catch (JsonProcessingException e) {
            log.error("JSON parse failed: {}. Raw response: {}", e.getOriginalMessage(), truncate(response));
            return ParseResult.failed("invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ParseResult.failed("response JSON is not an object");
        }

        if (!root.has("industries")) {
            log.warn("Model response is missing field industries: {}", truncate(response));
            return ParseResult.failed("missing field: industries");
        }
        JsonNode summaryNode = firstPresent(root, SUMMARY_FIELDS);
        if (summaryNode == null) {
            log.warn("Model response is missing field analysis_summary: {}", truncate(response));
            return ParseResult.failed("missing field: analysis_summary");
        }
        JsonNode confidenceNode = firstPresent(root, CONFIDENCE_FIELDS);
        if (confidenceNode == null) {
            log.warn("Model response is missing field confidence_score: {}", truncate(response));
            return ParseResult.failed("missing field: confidence_score");
        }

        String impactType = root.hasNonNull("impact_type") ? root.get("impact_type").asText() : null;
        return ParseResult.ok(normalizeIndustries(root.get("industries")),
                summaryNode.isNull() ? "" : summaryNode.asText(),
                coerceConfidence(confidenceNode),
                impactType);
    }

    /**
     * Returns the substring from the first '{' to the brace that brings the nesting depth back to
     * zero, or empty when there is no '{' or the braces never balance. Braces inside quoted strings
     * do not count.
     */
    public static Optional<String> extractJsonObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }

        int depth = 0;
        char quote = 0;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }

    static List<String> normalizeIndustries(JsonNode node) {
        List<String> raw = new ArrayList<>();
        if (node == null || node.isNull()) {
            return raw;
        }
        if (node.isArray()) {
            node.forEach(item -> raw.add(item.isNull() ? "" : item.asText()));
        } else {
            raw.add(node.asText());
        }

        Set<String> unique = new LinkedHashSet<>();
        for (String industry : raw) {
            String trimmed = industry.trim();
            if (trimmed.length() > MAX_INDUSTRY_LENGTH) {
                trimmed = trimmed.substring(0, MAX_INDUSTRY_LENGTH);
            }
            if (!trimmed.isEmpty()) {
                unique.add(trimmed);
            }
            if (unique.size() == MAX_INDUSTRIES) {
                break;
            }
        }
        return new ArrayList<>(unique);
    }

    static double coerceConfidence(JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                value = DEFAULT_CONFIDENCE;
            }
        } else {
            value = DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(value)) {
            value = DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static JsonNode firstPresent(JsonNode root, String[] names) {
        for (String name : names) {
            if (root.has(name)) {
                return root.get(name);
            }
        }
        return null;
    }

    private static String truncate(String text) {
        return text.length() > LOG_SNIPPET_LENGTH ? text.substring(0, LOG_SNIPPET_LENGTH) + "..." : text;
    }
}
