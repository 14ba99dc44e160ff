package com.example.policy.analyzer.source;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects link texts that are site chrome rather than policy titles: registration numbers,
 * copyright and navigation phrases, bare dates and very short strings.
 */
public final class ContentNoiseFilter {

    public static final int MIN_TITLE_LENGTH = 8;

    private static final List<Pattern> REGISTRATION_PATTERNS = List.of(
            Pattern.compile("京icp备\\d+号"),
            Pattern.compile("icp备案号"),
            Pattern.compile("京公网安备\\d+号"),
            Pattern.compile("公安备案号"),
            Pattern.compile("网站备案"),
            Pattern.compile("备案号"),
            Pattern.compile("icp证"),
            Pattern.compile("许可证号"));

    private static final List<String> BOILERPLATE_KEYWORDS = List.of(
            "版权所有", "copyright", "联系我们", "网站地图", "免责声明", "隐私政策", "使用条款",
            "技术支持", "网站维护", "更多", "查看更多", "点击查看", "详情", "返回", "首页",
            "上一页", "下一页", "分享", "打印", "收藏", "关闭", "确定", "取消");

    // used when stripping page bodies line by line
    private static final List<String> NAVIGATION_KEYWORDS = List.of(
            "导航", "菜单", "首页", "返回", "上一页", "下一页", "版权", "联系我们", "Copyright");

    private static final Pattern PURE_DATE = Pattern.compile("^\\d{4}[-/]\\d{1,2}[-/]\\d{1,2}$");

    private ContentNoiseFilter() {
    }

    public static boolean shouldSkipContent(String text) {
        if (text == null || text.isBlank()) {
            return true;
        }
        String trimmed = text.trim();
        String lower = trimmed.toLowerCase();

        for (Pattern pattern : REGISTRATION_PATTERNS) {
            if (pattern.matcher(lower).find()) {
                return true;
            }
        }
        for (String keyword : BOILERPLATE_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        if (trimmed.length() < MIN_TITLE_LENGTH) {
            return true;
        }
        return PURE_DATE.matcher(trimmed).matches();
    }

    public static boolean containsNavigationKeyword(String line) {
        for (String keyword : NAVIGATION_KEYWORDS) {
            if (line.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
