package com.example.policy.analyzer.source;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentNoiseFilterTest {

    @Test
    void rejectsRegistrationNumbers() {
        assertThat(ContentNoiseFilter.shouldSkipContent("京ICP备05070218号")).isTrue();
        assertThat(ContentNoiseFilter.shouldSkipContent("京公网安备11010202000001号")).isTrue();
    }

    @Test
    void rejectsBoilerplateAndNavigation() {
        assertThat(ContentNoiseFilter.shouldSkipContent("版权所有：中华人民共和国财政部")).isTrue();
        assertThat(ContentNoiseFilter.shouldSkipContent("Copyright 2025 www.gov.cn")).isTrue();
        assertThat(ContentNoiseFilter.shouldSkipContent("点击查看更多政策文件内容")).isTrue();
    }

    @Test
    void rejectsBlankShortAndPureDates() {
        assertThat(ContentNoiseFilter.shouldSkipContent(null)).isTrue();
        assertThat(ContentNoiseFilter.shouldSkipContent("   ")).isTrue();
        assertThat(ContentNoiseFilter.shouldSkipContent("政策解读")).isTrue();
        assertThat(ContentNoiseFilter.shouldSkipContent("2025-06-03")).isTrue();
        assertThat(ContentNoiseFilter.shouldSkipContent("2025/6/3")).isTrue();
    }

    @Test
    void keepsPolicyTitles() {
        assertThat(ContentNoiseFilter.shouldSkipContent("国务院关于加快发展先进制造业的若干意见")).isFalse();
    }

    @Test
    void detectsNavigationLines() {
        assertThat(ContentNoiseFilter.containsNavigationKeyword("网站导航")).isTrue();
        assertThat(ContentNoiseFilter.containsNavigationKeyword("一、总体要求")).isFalse();
    }
}
