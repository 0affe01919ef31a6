package com.goormthonuniv.factmerge.authority;

import com.goormthonuniv.factmerge.util.TextUtils;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 출처(도메인) 신뢰도의 정적 규칙 계층.
 * - tier 0: 큐레이션된 도메인 → 점수 테이블 (URL 부분 문자열 매칭, 등록 순서가 우선순위)
 * - tier 1: 정부/국제기구/학술 TLD 정규식 (첫 매칭 우선)
 * - 등록 도메인(registrable domain) 추출: 캐시 키
 *
 * 점수 범위: 0.0 ~ 1.0
 * - 0.90+: 국제기구/정부/주요 통신사
 * - 0.80~0.89: 신뢰 언론, 대학
 * - 0.40~0.70: 성향이 뚜렷한 매체
 * - 0.30 미만: 국영 선전/음모론 매체 (인기도는 높아도 수동 보정)
 */
@Component
public class DomainTrustPolicy {

    /** 복합 공개 접미사 (co.uk, gov.au ...) 판별용 두 번째 레이블 */
    private static final Set<String> COMPOUND_SECOND_LEVEL = Set.of("gov", "ac", "co", "edu", "org", "net");

    private final Map<String, Double> staticScores = new LinkedHashMap<>();

    private final List<Map.Entry<Pattern, Double>> tldPatterns = new ArrayList<>();

    // URI 가 거부하거나 host 를 못 주는 입력용 (공백, '_' 가 든 호스트 ...)
    private static final Pattern LENIENT_HOST =
            Pattern.compile("^(?:[a-z][a-z0-9+.-]*://)?(?:[^/?#\\s@]*@)?([^/?#:\\s]+)");

    private final LevenshteinDistance distance = new LevenshteinDistance(1);

    public DomainTrustPolicy() {
        // ===== 큐레이션 언론/기관 =====
        put("reuters.com", 0.94);
        put("apnews.com", 0.94);
        put("bbc.com", 0.91);
        put("theguardian.com", 0.87);
        put("nytimes.com", 0.86);
        put("npr.org", 0.88);
        put("unep.org", 0.97);
        put("who.int", 0.97);
        put("un.org", 0.97);
        put("cdc.gov", 0.96);
        put("nih.gov", 0.97);
        put("nature.com", 0.97);
        put("foxnews.com", 0.65);
        put("breitbart.com", 0.35);
        put("infowars.com", 0.10);

        // ===== 수동 보정: 인기도는 높지만 신뢰도 낮음 =====
        put("rt.com", 0.20);          // 러시아 국영
        put("sputniknews.com", 0.18);
        put("globalresearch.ca", 0.15);
        put("zerohedge.com", 0.28);
        put("dailywire.com", 0.45);
        put("thedailybeast.com", 0.58);
        put("huffpost.com", 0.65);
        put("buzzfeednews.com", 0.68);

        // ===== TLD 규칙 (순서 중요) =====
        rule("\\.gov(/|$|\\.)", 0.93);
        rule("\\.gov\\.[a-z]{2}(/|$)", 0.92);
        rule("\\.int(/|$|\\.)", 0.94);
        rule("\\.un\\.org", 0.97);
        rule("\\.edu(/|$|\\.)", 0.88);
        rule("\\.edu\\.[a-z]{2}(/|$)", 0.87);
        rule("\\.ac\\.[a-z]{2}(/|$)", 0.87);
    }

    /** tier 0: 테이블 도메인이 URL 에 포함되면 그 점수 */
    public Optional<Double> staticScore(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        String u = url.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> e : staticScores.entrySet()) {
            if (u.contains(e.getKey())) return Optional.of(e.getValue());
        }
        return Optional.empty();
    }

    /** tier 1: TLD 패턴 */
    public Optional<Double> patternScore(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        String u = url.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, Double> e : tldPatterns) {
            if (e.getKey().matcher(u).find()) return Optional.of(e.getValue());
        }
        return Optional.empty();
    }

    /**
     * 발행처 이름을 테이블 도메인의 첫 레이블과 비교 (예: "Reuters" → reuters.com).
     * 4글자 이상 레이블은 편집거리 1 까지 허용.
     */
    public Optional<Double> publisherScore(String publisher) {
        if (publisher == null || publisher.isBlank()) return Optional.empty();
        List<String> candidates = new ArrayList<>(TextUtils.tokens(publisher));
        candidates.add(publisher.replaceAll("[^\\p{L}\\p{N}]", "").toLowerCase(Locale.ROOT));
        for (Map.Entry<String, Double> e : staticScores.entrySet()) {
            String label = e.getKey().substring(0, e.getKey().indexOf('.'));
            for (String c : candidates) {
                if (c.equals(label)) return Optional.of(e.getValue());
                if (label.length() >= 4 && c.length() >= 4 && distance.apply(c, label) >= 0) {
                    return Optional.of(e.getValue());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 등록 도메인 추출. 'https://eaps.mit.edu/x' → 'mit.edu', 'news.bbc.co.uk' → 'bbc.co.uk'.
     * 호스트를 얻을 수 없으면 빈 문자열.
     */
    public String registrableDomain(String urlOrHost) {
        String host = normalizeHost(urlOrHost);
        if (host == null || host.isEmpty()) return "";
        String[] parts = host.split("\\.");
        if (parts.length >= 3 && COMPOUND_SECOND_LEVEL.contains(parts[parts.length - 2])) {
            return String.join(".", Arrays.copyOfRange(parts, parts.length - 3, parts.length));
        }
        if (parts.length >= 2) {
            return parts[parts.length - 2] + "." + parts[parts.length - 1];
        }
        return host;
    }

    /** 입력이 URL이든 호스트든 받아서 소문자 host (www. 제거, 포트 제거) */
    public String normalizeHost(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return null;
        String raw = urlOrHost.trim().toLowerCase(Locale.ROOT);

        String host = null;
        try {
            host = new URI(raw.contains("://") ? raw : "https://" + raw).getHost();
        } catch (URISyntaxException e) {
            // 아래 느슨한 추출로 넘어감
            host = null;
        }
        if (host == null) {
            Matcher m = LENIENT_HOST.matcher(raw);
            if (!m.find()) return "";
            host = m.group(1);
        }
        if (host.startsWith("www.")) host = host.substring(4);
        if (host.endsWith(".")) host = host.substring(0, host.length() - 1);
        return host;
    }

    Map<String, Double> staticTable() {
        return Collections.unmodifiableMap(staticScores);
    }

    // ------------------------ 내부 유틸 ------------------------

    private void put(String domain, double score) {
        staticScores.put(domain.toLowerCase(Locale.ROOT), score);
    }

    private void rule(String regex, double score) {
        tldPatterns.add(Map.entry(Pattern.compile(regex), score));
    }
}
