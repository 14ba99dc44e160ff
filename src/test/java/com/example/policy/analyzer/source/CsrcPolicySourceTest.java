package com.example.policy.analyzer.source;

import com.example.policy.analyzer.entity.PolicyEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsrcPolicySourceTest {

    private static final Clock CLOCK = Clock.fixed(LocalDate.of(2025, 7, 1).atStartOfDay(ZoneId.of("Asia/Shanghai"))
            .toInstant(), ZoneId.of("Asia/Shanghai"));

    private static final String PAGE = "{\"data\": {\"results\": ["
            + "{\"title\": \"关于修改《上市公司信息披露管理办法》的决定\", \"content\": \"为进一步规范上市公司信息披露行为\","
            + " \"publishedTimeStr\": \"2025-06-13 17:30:00\", \"url\": \"/csrc/c101953/c7551234/content.shtml\","
            + " \"domainMetaList\": [{\"resultList\": [{\"key\": \"section\", \"value\": \"上市公司监管部\"}]}]},"
            + "{\"title\": \"公募基金费率改革工作方案\", \"content\": \"\", \"memo\": \"推动基金行业降费让利\","
            + " \"publishTime\": \"2025/5/20\", \"url\": \"https://www.csrc.gov.cn/x.shtml\"},"
            + "{\"title\": \"短标题\", \"publishedTimeStr\": \"2025-06-01\"}"
            + "]}}";

    private final CsrcPolicySource source = new CsrcPolicySource(CLOCK, new ObjectMapper());

    @Test
    void readsSearchApiResults() {
        List<PolicyEvent> events = source.extractCandidates(PAGE, source.pageUrl(0), null);

        assertThat(events).hasSize(2);
        PolicyEvent first = events.get(0);
        assertThat(first.getDate()).isEqualTo(LocalDate.of(2025, 6, 13));
        assertThat(first.getSourceUrl()).isEqualTo("http://www.csrc.gov.cn/csrc/c101953/c7551234/content.shtml");
        assertThat(first.getDepartment()).isEqualTo("上市公司监管部");
        assertThat(first.getEventType()).isEqualTo("上市监管");
        assertThat(first.getContent()).isEqualTo("为进一步规范上市公司信息披露行为");
        assertThat(first.getPolicyLevel()).isEqualTo("国家级");

        PolicyEvent second = events.get(1);
        assertThat(second.getDate()).isEqualTo(LocalDate.of(2025, 5, 20));
        assertThat(second.getContent()).isEqualTo("推动基金行业降费让利");
        assertThat(second.getEventType()).isEqualTo("基金监管");
        assertThat(second.getDepartment()).isEqualTo("证监会");
    }

    @Test
    void targetMonthApplies() {
        List<PolicyEvent> events = source.extractCandidates(PAGE, source.pageUrl(0), YearMonth.of(2025, 5));

        assertThat(events).extracting(PolicyEvent::getTitle).containsExactly("公募基金费率改革工作方案");
    }

    @Test
    void unexpectedStructureYieldsNothing() {
        assertThat(source.extractCandidates("{\"code\": 500}", source.pageUrl(0), null)).isEmpty();
    }

    @Test
    void invalidJsonIsAPageError() {
        assertThatThrownBy(() -> source.extractCandidates("<html>", source.pageUrl(0), null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void pagesAreOneBased() {
        assertThat(source.pageUrl(0)).endsWith("&page=1");
        assertThat(source.getDefaultMaxPages()).isEqualTo(50);
    }
}
