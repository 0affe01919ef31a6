package com.goormthonuniv.factmerge.util;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern URL = Pattern.compile("(https?://\\S+)");
    private static final Pattern EMOJI = Pattern.compile("[\\p{So}\\p{Cn}]+");
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]{2,}");
    private static final String ELLIPSIS = "…";

    private static final Set<String> STOPWORDS = Set.of(
            "the","a","an","to","of","and","or","is","are","was","were","be","been","in","on","for",
            "with","by","at","as","that","this","these","those","it","its","from","has","have","had"
    );

    private TextUtils() {}

    public static String normalize(String text) {
        if (text == null) return "";
        String t = text.strip();
        t = URL.matcher(t).replaceAll(" ");
        t = EMOJI.matcher(t).replaceAll(" ");
        return t.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /** 정규화 후 불용어를 뺀 토큰 목록 (순서 유지, 중복 허용) */
    public static List<String> tokens(String text) {
        String norm = normalize(text);
        if (norm.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        Matcher m = TOKEN.matcher(norm);
        while (m.find()) {
            String t = m.group();
            if (!STOPWORDS.contains(t)) out.add(t);
        }
        return out;
    }

    /** 앞 max 글자 + "…" (짧아도 항상 붙인다) */
    public static String topicOf(String text, int max) {
        if (text == null) return ELLIPSIS;
        String head = text.length() <= max ? text : text.substring(0, max);
        return head + ELLIPSIS;
    }

    public static String head(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }

    public static int countMatches(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) return 0;
        Matcher m = pattern.matcher(text);
        int count = 0;
        while (m.find()) count++;
        return count;
    }

    /** 문장 분리. boundary 는 분리 지점 앞 문자의 lookbehind 패턴 */
    public static List<String> splitSentences(String text, Pattern boundary) {
        if (text == null || text.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String s : boundary.split(text)) {
            String t = s.strip();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    public static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
