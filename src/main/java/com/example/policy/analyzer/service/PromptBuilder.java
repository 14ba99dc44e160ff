package com.example.policy.analyzer.service;

import com.example.policy.analyzer.dto.AnalysisPrompt;
import org.springframework.stereotype.Service;

@Service
public class PromptBuilder {

    public static final int RICH_CONTENT_THRESHOLD = 50;
    public static final int MAX_CONTENT_LENGTH = 3000;
    public static final String TRUNCATION_MARKER = "...(内容过长已截断)";

    private static final String ANALYSIS_REQUEST = "请从以下几个方面进行分析：\n"
            + "1. 相关行业：列出可能受到影响的主要行业（最多5个）\n"
            + "2. 影响程度：评估对股市的整体影响程度（正面/负面/中性）\n"
            + "3. 分析摘要：%s\n"
            + "4. 置信度：对分析结果的置信度评分（0-1之间%s）\n\n"
            + "请只返回一个完整的JSON对象，不要包含其他文字：\n"
            + "{\n"
            + "    \"industries\": [\"行业1\", \"行业2\"],\n"
            + "    \"impact_type\": \"正面/负面/中性\",\n"
            + "    \"analysis_summary\": \"分析摘要\",\n"
            + "    \"confidence_score\": %s\n"
            + "}\n";

    /**
     * Builds the analysis prompt. Content longer than 50 characters selects the detailed template;
     * otherwise the model is told it only has the title and should lower its confidence.
     */
    public AnalysisPrompt build(String title, String content, String eventType, String sourceUrl) {
        if (content != null && content.length() > RICH_CONTENT_THRESHOLD) {
            return new AnalysisPrompt(buildRich(title, content, eventType), true);
        }
        return new AnalysisPrompt(buildSparse(title, content, eventType, sourceUrl), false);
    }

    private String buildRich(String title, String content, String eventType) {
        String body = content.length() > MAX_CONTENT_LENGTH
                ? content.substring(0, MAX_CONTENT_LENGTH) + TRUNCATION_MARKER
                : content;

        return "请分析以下政策对中国股市的影响：\n\n"
                + "标题：" + title + "\n"
                + "事件类型：" + orDefault(eventType, "未知") + "\n\n"
                + "完整内容：\n" + body + "\n\n"
                + String.format(ANALYSIS_REQUEST, "基于完整政策内容，详细说明政策的主要影响点和逻辑", "", "0.8");
    }

    private String buildSparse(String title, String content, String eventType, String sourceUrl) {
        return "请分析以下政策对中国股市的影响：\n\n"
                + "标题：" + title + "\n"
                + "内容：" + orDefault(content, "无详细内容") + "\n"
                + "事件类型：" + orDefault(eventType, "未知") + "\n"
                + "原文链接：" + orDefault(sourceUrl, "无") + "\n\n"
                + "注意：由于缺乏详细政策内容，请基于标题进行初步分析，并在置信度评分中体现这一限制。\n\n"
                + String.format(ANALYSIS_REQUEST, "简要说明政策的主要影响点和逻辑", "，由于缺乏详细内容应适当降低", "0.5");
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
