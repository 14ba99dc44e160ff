package com.example.policy.analyzer.service;

import com.example.policy.analyzer.dto.BatchSummary;
import com.example.policy.analyzer.dto.ClassificationResult;
import com.example.policy.analyzer.dto.LlmCallResult;
import com.example.policy.analyzer.entity.AnalysisOutcome;
import com.example.policy.analyzer.entity.AnalysisStatus;
import com.example.policy.analyzer.entity.ContentQuality;
import com.example.policy.analyzer.entity.PolicyEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PolicyAnalysisServiceTest {

    private static final String TWO_INDUSTRIES = "{\"industries\": [\"新能源\", \"汽车\"], \"impact_type\": \"正面\", "
            + "\"analysis_summary\": \"利好新能源汽车\", \"confidence_score\": 0.9}";
    private static final String NO_INDUSTRIES = "{\"industries\": [], \"analysis_summary\": \"无明显影响\", "
            + "\"confidence_score\": 0.6}";

    private PolicyContentFetcher contentFetcher;
    private LlmService llmService;
    private PolicyStoreService storeService;
    private PolicyAnalysisService service;

    @BeforeEach
    void setUp() {
        contentFetcher = mock(PolicyContentFetcher.class);
        llmService = mock(LlmService.class);
        storeService = mock(PolicyStoreService.class);
        service = new PolicyAnalysisService(contentFetcher, new PromptBuilder(), llmService,
                new AnalysisResponseParser(), storeService, new ConcurrentAnalysisRunner());
        ReflectionTestUtils.setField(service, "batchDelayMs", 0L);
        ReflectionTestUtils.setField(service, "reanalysisDelayMs", 0L);
        when(storeService.saveResult(anyLong(), any(ClassificationResult.class))).thenReturn(true);
        when(storeService.getStoredContent(anyLong())).thenReturn(Optional.empty());
    }

    @Test
    void fetchedFullContentGivesRichPromptAndSuccess() {
        String page = "政".repeat(600);
        when(contentFetcher.fetchContent("https://www.gov.cn/p.htm")).thenReturn(page);
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success(TWO_INDUSTRIES, 1));

        ClassificationResult result = service.analyzeRecord(event(1L, "关于促进新能源汽车消费的通知", null,
                "https://www.gov.cn/p.htm"));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmService).complete(prompt.capture());
        assertThat(prompt.getValue()).contains("完整内容：");
        assertThat(result.getPolicyId()).isEqualTo(1L);
        assertThat(result.getContentQuality()).isEqualTo(ContentQuality.FULL);
        assertThat(result.getOutcome()).isEqualTo(AnalysisOutcome.SUCCESS);
        assertThat(result.getStatus()).isEqualTo(AnalysisStatus.SUCCESS);
        assertThat(result.getIndustries()).containsExactly("新能源", "汽车");
        assertThat(result.getConfidenceScore()).isEqualTo(0.9);
        assertThat(result.getImpactType()).isEqualTo("正面");
        assertThat(result.getFullContent()).isEqualTo(page);
    }

    @Test
    void inlineContentIsUsedWithoutFetching() {
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success(TWO_INDUSTRIES, 1));

        ClassificationResult result = service.analyzeRecord(event(2L, "标题", "内".repeat(150), "https://x.gov.cn"));

        verify(contentFetcher, never()).fetchContent(anyString());
        assertThat(result.getContentQuality()).isEqualTo(ContentQuality.PARTIAL);
    }

    @Test
    void exhaustedLlmCallGivesFailedResultKeepingContent() {
        when(contentFetcher.fetchContent(anyString())).thenReturn("文".repeat(300));
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.failure("status 503", 3));

        ClassificationResult result = service.analyzeRecord(event(3L, "标题", null, "https://x.gov.cn"));

        assertThat(result.getOutcome()).isEqualTo(AnalysisOutcome.FAILED);
        assertThat(result.getStatus()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(result.getIndustries()).containsExactly("分析失败");
        assertThat(result.getConfidenceScore()).isZero();
        assertThat(result.getFullContent()).hasSize(300);
        assertThat(result.getPolicyId()).isEqualTo(3L);
    }

    @Test
    void emptyIndustriesGiveNoIndustryOutcome() {
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success(NO_INDUSTRIES, 1));

        ClassificationResult result = service.analyzePolicy("某地举办文化节", "", null, null);

        assertThat(result.getOutcome()).isEqualTo(AnalysisOutcome.NO_INDUSTRY);
        assertThat(result.getStatus()).isEqualTo(AnalysisStatus.SUCCESS);
        assertThat(result.getIndustries()).containsExactly("分析后无相关行业");
        assertThat(result.getContentQuality()).isEqualTo(ContentQuality.TITLE_ONLY);
    }

    @Test
    void unparseableResponseGivesFailedResult() {
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success("I cannot answer that.", 1));

        ClassificationResult result = service.analyzePolicy("标题", "", null, null);

        assertThat(result.getOutcome()).isEqualTo(AnalysisOutcome.FAILED);
        assertThat(result.getSummary()).isEqualTo(PolicyAnalysisService.PARSE_FAILED_REASON);
    }

    @Test
    void unexpectedErrorDoesNotAbortBatch() {
        PolicyEvent broken = event(10L, "第一条政策标题", null, "https://a.gov.cn");
        PolicyEvent fine = event(11L, "第二条政策标题", null, "https://b.gov.cn");
        when(storeService.findUnanalyzed(5)).thenReturn(List.of(broken, fine));
        when(contentFetcher.fetchContent("https://a.gov.cn")).thenThrow(new IllegalStateException("boom"));
        when(contentFetcher.fetchContent("https://b.gov.cn")).thenReturn("");
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success(TWO_INDUSTRIES, 1));

        BatchSummary summary = service.analyzeBatch(5);

        assertThat(summary.getSelected()).isEqualTo(2);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getSucceeded()).isEqualTo(1);
        assertThat(summary.getSaved()).isEqualTo(2);
        ArgumentCaptor<ClassificationResult> saved = ArgumentCaptor.forClass(ClassificationResult.class);
        verify(storeService).saveResult(eq(10L), saved.capture());
        assertThat(saved.getValue().getOutcome()).isEqualTo(AnalysisOutcome.FAILED);
    }

    @Test
    void storeFailureIsCountedAsNotSaved() {
        when(storeService.findUnanalyzed(1)).thenReturn(List.of(event(20L, "政策标题", null, null)));
        when(storeService.saveResult(eq(20L), any(ClassificationResult.class))).thenReturn(false);
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success(TWO_INDUSTRIES, 1));

        BatchSummary summary = service.analyzeBatch(1);

        assertThat(summary.getSucceeded()).isEqualTo(1);
        assertThat(summary.getSaved()).isZero();
        assertThat(summary.getNotSaved()).isEqualTo(1);
    }

    @Test
    void asyncBatchAnalyzesAndPersistsEveryRecord() throws Exception {
        List<PolicyEvent> events = new ArrayList<>();
        for (long id = 1; id <= 5; id++) {
            events.add(event(id, "政策标题" + id, "", null));
        }
        when(storeService.findUnanalyzed(5)).thenReturn(events);
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success(TWO_INDUSTRIES, 1));

        BatchSummary summary = service.analyzeBatchAsync(5, 2).get(10, TimeUnit.SECONDS);

        assertThat(summary.getSelected()).isEqualTo(5);
        assertThat(summary.getSucceeded()).isEqualTo(5);
        assertThat(summary.getSaved()).isEqualTo(5);
        assertThat(summary.getSkipped()).isZero();
        verify(storeService, times(5)).saveResult(anyLong(), any(ClassificationResult.class));
    }

    @Test
    void expiredDeadlineSkipsRemainingRecords() throws Exception {
        List<PolicyEvent> events = List.of(event(1L, "政策标题一", "", null), event(2L, "政策标题二", "", null),
                event(3L, "政策标题三", "", null));
        when(storeService.findUnanalyzed(3)).thenReturn(events);

        BatchSummary summary = service.analyzeBatchAsync(3, 2, Duration.ZERO).get(10, TimeUnit.SECONDS);

        assertThat(summary.getSelected()).isEqualTo(3);
        assertThat(summary.getSkipped()).isEqualTo(3);
        assertThat(summary.getSaved()).isZero();
        verify(llmService, never()).complete(anyString());
    }

    @Test
    void sequentialBatchStopsStartingRecordsAfterDeadline() {
        List<PolicyEvent> events = List.of(event(1L, "政策标题一", "", null), event(2L, "政策标题二", "", null),
                event(3L, "政策标题三", "", null));
        when(storeService.findUnanalyzed(3)).thenReturn(events);
        when(llmService.complete(anyString())).thenAnswer(invocation -> {
            Thread.sleep(300);
            return LlmCallResult.success(TWO_INDUSTRIES, 1);
        });

        BatchSummary summary = service.analyzeBatch(3, Duration.ofMillis(100));

        assertThat(summary.getSelected()).isEqualTo(3);
        assertThat(summary.getSucceeded()).isEqualTo(1);
        assertThat(summary.getSaved()).isEqualTo(1);
        assertThat(summary.getSkipped()).isEqualTo(2);
        verify(llmService, times(1)).complete(anyString());
    }

    @Test
    void expiredDeadlineSkipsWholeReanalysis() {
        when(storeService.findDegraded(10)).thenReturn(List.of(event(30L, "此前分析失败的政策", "正文", null)));

        BatchSummary summary = service.reanalyzeDegraded(10, Duration.ZERO);

        assertThat(summary.getSkipped()).isEqualTo(1);
        verify(llmService, never()).complete(anyString());
        verify(storeService, never()).saveResult(anyLong(), any(ClassificationResult.class));
    }

    @Test
    void deadlineBeyondOneDayIsRejected() {
        assertThatThrownBy(() -> service.analyzeBatch(3, Duration.ofSeconds(Long.MAX_VALUE)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.analyzeBatchAsync(3, 2, Duration.ofDays(2)))
                .isInstanceOf(IllegalArgumentException.class);
        verify(storeService, never()).findUnanalyzed(anyInt());
    }

    @Test
    void reanalysisReusesStoredContent() {
        PolicyEvent degraded = event(30L, "此前分析失败的政策", null, "https://c.gov.cn");
        when(storeService.findDegraded(10)).thenReturn(List.of(degraded));
        when(storeService.getStoredContent(30L)).thenReturn(Optional.of("存".repeat(600)));
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success(TWO_INDUSTRIES, 1));

        BatchSummary summary = service.reanalyzeDegraded(10);

        verify(contentFetcher, never()).fetchContent(anyString());
        assertThat(summary.getSucceeded()).isEqualTo(1);
        ArgumentCaptor<ClassificationResult> saved = ArgumentCaptor.forClass(ClassificationResult.class);
        verify(storeService).saveResult(eq(30L), saved.capture());
        assertThat(saved.getValue().getContentQuality()).isEqualTo(ContentQuality.FULL);
    }

    @Test
    void reanalysisWithoutStoredContentFetchesAgain() {
        PolicyEvent degraded = event(31L, "此前无相关行业的政策", null, "https://d.gov.cn");
        when(storeService.findDegraded(10)).thenReturn(List.of(degraded));
        when(contentFetcher.fetchContent("https://d.gov.cn")).thenReturn("");
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success(NO_INDUSTRIES, 1));

        BatchSummary summary = service.reanalyzeDegraded(10);

        verify(contentFetcher).fetchContent("https://d.gov.cn");
        assertThat(summary.getNoIndustry()).isEqualTo(1);
    }

    @Test
    void storedContentReanalysisNeverFetches() {
        when(storeService.findWithStoredContent(10)).thenReturn(List.of(event(40L, "政策标题", null, "https://e.gov.cn")));
        when(storeService.getStoredContent(40L)).thenReturn(Optional.of("存".repeat(200)));
        when(llmService.complete(anyString())).thenReturn(LlmCallResult.success(TWO_INDUSTRIES, 1));

        BatchSummary summary = service.reanalyzeFromStoredContent(10);

        verify(contentFetcher, never()).fetchContent(anyString());
        assertThat(summary.getSucceeded()).isEqualTo(1);
    }

    private static PolicyEvent event(Long id, String title, String content, String sourceUrl) {
        PolicyEvent event = new PolicyEvent();
        event.setId(id);
        event.setDate(LocalDate.of(2025, 6, 1));
        event.setTitle(title);
        event.setContent(content);
        event.setEventType("经济政策");
        event.setSourceUrl(sourceUrl);
        return event;
    }
}
