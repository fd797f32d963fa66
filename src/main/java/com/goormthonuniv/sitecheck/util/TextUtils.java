package com.goormthonuniv.sitecheck.util;

import java.util.*;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {}

    public static String collapseWhitespace(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text.replace('\u00A0', ' ')).replaceAll(" ").strip();
    }

    public static String truncate(String text, int maxLen) {
        if (text == null) return "";
        return text.length() > maxLen ? text.substring(0, maxLen) : text;
    }

    /** text(소문자 비교)에 포함된 키워드를 입력 순서대로 반환 */
    public static List<String> findKeywords(String text, Collection<String> keywords) {
        if (text == null || text.isBlank()) return List.of();
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        for (String k : keywords) {
            if (lower.contains(k.toLowerCase(Locale.ROOT))) found.add(k);
        }
        return found;
    }

    public static double clamp(double v, double min, double max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }
}
