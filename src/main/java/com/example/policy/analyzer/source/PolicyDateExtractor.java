package com.example.policy.analyzer.source;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort publication date for a listing link: the URL or title first, then the closest
 * ancestor whose text carries a date.
 */
@Slf4j
public final class PolicyDateExtractor {

    private static final Pattern LOOSE_DATE = Pattern.compile("(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})");
    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern CHINESE_DATE = Pattern.compile("(\\d{4})年(\\d{1,2})月(\\d{1,2})日");
    // e.g. /zhengce/content/202506/t20250603_123.htm
    private static final Pattern URL_STAMP = Pattern.compile("t(\\d{4})(\\d{2})(\\d{2})_");

    private PolicyDateExtractor() {
    }

    /**
     * Returns the first valid date in the text ({@code 2025-6-3}, {@code 2025/06/03},
     * {@code 2025年6月3日}), or null.
     */
    public static LocalDate findDate(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        LocalDate date = firstValid(LOOSE_DATE.matcher(text));
        if (date == null) {
            date = firstValid(CHINESE_DATE.matcher(text));
        }
        return date;
    }

    public static LocalDate fromUrlOrTitle(String url, String title) {
        LocalDate date = findDate((url == null ? "" : url) + " " + (title == null ? "" : title));
        if (date == null && url != null) {
            date = firstValid(URL_STAMP.matcher(url));
        }
        return date;
    }

    public static LocalDate fromAncestors(Element element) {
        Element parent = element.parent();
        while (parent != null) {
            LocalDate date = firstValid(ISO_DATE.matcher(parent.text()));
            if (date != null) {
                return date;
            }
            parent = parent.parent();
        }
        return null;
    }

    /**
     * Applies URL/title, then ancestor text, then {@code today} with a warning.
     */
    public static LocalDate extract(Element link, String url, String title, LocalDate today) {
        LocalDate date = fromUrlOrTitle(url, title);
        if (date == null) {
            date = fromAncestors(link);
        }
        if (date == null) {
            log.warn("No date found, using current date: {}", abbreviate(title));
            date = today;
        }
        return date;
    }

    private static LocalDate firstValid(Matcher matcher) {
        while (matcher.find()) {
            try {
                return LocalDate.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                        Integer.parseInt(matcher.group(3)));
            } catch (DateTimeException | NumberFormatException e) {
                // not a real calendar date, keep scanning
            }
        }
        return null;
    }

    static String abbreviate(String title) {
        if (title == null) {
            return "";
        }
        return title.length() > 50 ? title.substring(0, 50) + "..." : title;
    }
}
