package com.example.policy.analyzer.service;

import com.example.policy.analyzer.dto.ParseResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisResponseParserTest {

    private final AnalysisResponseParser parser = new AnalysisResponseParser();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void extractsOutermostObjectFromSurroundingText() {
        assertThat(AnalysisResponseParser.extractJsonObject("noise {outer: {inner: 1}} trailing"))
                .contains("{outer: {inner: 1}}");
    }

    @Test
    void unbalancedBracesYieldNothing() {
        assertThat(AnalysisResponseParser.extractJsonObject("{\"a\": {\"b\": 1}")).isEmpty();
        assertThat(AnalysisResponseParser.extractJsonObject("no json here")).isEmpty();
    }

    @Test
    void bracesInsideStringsAreIgnored() {
        String text = "result: {\"analysis_summary\": \"uses } and { freely\", \"x\": 1} done";
        assertThat(AnalysisResponseParser.extractJsonObject(text))
                .contains("{\"analysis_summary\": \"uses } and { freely\", \"x\": 1}");
    }

    @Test
    void parsesResponseWrappedInMarkdown() {
        String response = "分析如下：\n```json\n{\n  \"industries\": [\"新能源\", \" 汽车 \", \"新能源\", \"\"],\n"
                + "  \"impact_type\": \"正面\",\n  \"analysis_summary\": \"利好新能源汽车产业链\",\n"
                + "  \"confidence_score\": 0.85\n}\n```";

        ParseResult result = parser.parse(response);

        assertThat(result.isOk()).isTrue();
        assertThat(result.getIndustries()).containsExactly("新能源", "汽车");
        assertThat(result.getSummary()).isEqualTo("利好新能源汽车产业链");
        assertThat(result.getConfidence()).isEqualTo(0.85);
        assertThat(result.getImpactType()).isEqualTo("正面");
    }

    @Test
    void acceptsLenientJsonAndFieldAliases() {
        ParseResult result = parser.parse("{industries: '银行', summary: '降准', confidenceScore: '0.7',}");

        assertThat(result.isOk()).isTrue();
        assertThat(result.getIndustries()).containsExactly("银行");
        assertThat(result.getSummary()).isEqualTo("降准");
        assertThat(result.getConfidence()).isEqualTo(0.7);
    }

    @Test
    void missingRequiredFieldFails() {
        ParseResult result = parser.parse("{\"industries\": [\"银行\"], \"confidence_score\": 0.5}");

        assertThat(result.isOk()).isFalse();
        assertThat(result.getFailureReason()).contains("analysis_summary");
    }

    @Test
    void emptyOrUnbalancedResponseFails() {
        assertThat(parser.parse("").isOk()).isFalse();
        assertThat(parser.parse("{\"industries\": [").isOk()).isFalse();
    }

    @Test
    void emptyIndustriesStillParse() {
        ParseResult result = parser.parse(
                "{\"industries\": [], \"analysis_summary\": \"无明显影响\", \"confidence_score\": 0.6}");

        assertThat(result.isOk()).isTrue();
        assertThat(result.getIndustries()).isEmpty();
    }

    @Test
    void confidenceIsClampedAndDefaulted() throws Exception {
        assertThat(AnalysisResponseParser.coerceConfidence(mapper.readTree("1.7"))).isEqualTo(1.0);
        assertThat(AnalysisResponseParser.coerceConfidence(mapper.readTree("-0.2"))).isEqualTo(0.0);
        assertThat(AnalysisResponseParser.coerceConfidence(mapper.readTree("\"high\""))).isEqualTo(0.5);
        assertThat(AnalysisResponseParser.coerceConfidence(mapper.readTree("null"))).isEqualTo(0.5);
    }

    @Test
    void scalarIndustryBecomesSingleton() throws Exception {
        assertThat(AnalysisResponseParser.normalizeIndustries(mapper.readTree("\" 半导体 \"")))
                .containsExactly("半导体");
    }

    @Test
    void industriesAreCappedAtFiveAndDeduplicated() {
        ParseResult result = parser.parse("{\"industries\": [\"银行\", \"银行\", \"保险\", \"券商\", \"地产\", "
                + "\"建材\", \"钢铁\", \"煤炭\"], \"analysis_summary\": \"金融支持\", \"confidence_score\": 0.8}");

        assertThat(result.isOk()).isTrue();
        assertThat(result.getIndustries()).containsExactly("银行", "保险", "券商", "地产", "建材");
    }

    @Test
    void overlongIndustryNameIsTruncated() throws Exception {
        String longName = "新".repeat(80);

        List<String> industries = AnalysisResponseParser.normalizeIndustries(mapper.readTree("[\"" + longName + "\"]"));

        assertThat(industries).hasSize(1);
        assertThat(industries.get(0)).hasSize(AnalysisResponseParser.MAX_INDUSTRY_LENGTH);
    }
}
