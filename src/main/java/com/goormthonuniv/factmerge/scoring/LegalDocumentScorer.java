package com.goormthonuniv.factmerge.scoring;

import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.util.TextUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 법률 문서 채점. 외부 호출 없이 URL·본문만 본다.
 */
@Component
@RequiredArgsConstructor
public class LegalDocumentScorer implements CredibilityScorer {

    public static final String OFFICIAL_SOURCE = "official_source";
    public static final String JURISDICTION = "jurisdiction_authority";
    public static final String STATUTE_CITATIONS = "statute_citations";
    public static final String RECENCY = "recency";

    public static final Map<String, Double> WEIGHTS = ScoreCard.weights(
            OFFICIAL_SOURCE, 0.35, JURISDICTION, 0.30, STATUTE_CITATIONS, 0.20, RECENCY, 0.15);

    static final double OTHER_URL = 0.45;
    static final double NO_URL = 0.4;
    static final double DEFAULT_JURISDICTION = 0.5;
    static final double PER_FAMILY = 0.2;
    static final double NO_STATUTES = 0.25;
    static final double HALF_LIFE_YEARS = 15.0;
    static final double RECENCY_FLOOR = 0.2;
    static final double UNKNOWN_RECENCY = 0.5;

    private static final List<String> OFFICIAL_MARKERS = List.of(".gov", ".gov.uk", ".europa.eu", ".un.org", ".court");

    // 단어 경계로 매칭 ("us" 가 "focus" 에 걸리지 않도록)
    private static final Map<Pattern, Double> JURISDICTIONS = new LinkedHashMap<>();
    static {
        keyword("supreme court", 1.0);
        keyword("court of appeals", 0.88);
        keyword("district court", 0.80);
        keyword("federal", 0.85);
        keyword("state", 0.70);
        keyword("municipal", 0.55);
        keyword("us", 0.85);
        keyword("eu", 0.82);
        keyword("uk", 0.80);
    }

    private static final List<Pattern> STATUTE_FAMILIES = List.of(
            Pattern.compile("\\b\\d+\\s+U\\.?S\\.?C\\.?\\s+§?\\s*\\d+"),
            Pattern.compile("\\bPub\\.?\\s*L\\.?\\s*\\d+-\\d+"),
            Pattern.compile("\\b\\d+\\s+C\\.?F\\.?R\\.?\\s+§?\\s*\\d+"),
            Pattern.compile("\\bArticle\\s+\\d+"),
            Pattern.compile("(?:\\bSection|§)\\s*\\d+")
    );

    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");

    private final Clock clock;

    @Override
    public DocumentType documentType() {
        return DocumentType.LEGAL_DOCUMENT;
    }

    @Override
    public CredibilityScore score(Document doc) {
        String text = doc.getRawText() == null ? "" : doc.getRawText();

        double official = officialSource(doc.getSourceUrl());
        double jurisdiction = jurisdiction(text);
        int families = statuteFamilies(text);
        double statutes = SignalMath.saturating(families, PER_FAMILY, NO_STATUTES);

        Object rawDate = doc.getMetadata().get(MetadataKeys.PUBLISHED_DATE);
        Optional<OffsetDateTime> published = SignalMath.parseDate(rawDate);
        // 본문 연도는 날짜 메타데이터가 아예 없을 때만 쓴다 (있는데 못 읽으면 중립값)
        boolean dateGiven = rawDate != null && !rawDate.toString().isBlank();
        Integer textYear = dateGiven ? null : firstYear(text);
        double recency;
        if (published.isPresent()) {
            double ageYears = SignalMath.ageDays(published.get(), clock) / 365.0;
            recency = SignalMath.halfLifeDecay(ageYears, HALF_LIFE_YEARS, RECENCY_FLOOR);
        } else if (textYear != null) {
            int ageYears = LocalDate.now(clock).getYear() - textYear;
            recency = SignalMath.halfLifeDecay(ageYears, HALF_LIFE_YEARS, RECENCY_FLOOR);
        } else {
            recency = UNKNOWN_RECENCY;
        }

        return ScoreCard.weighted(WEIGHTS)
                .signal(OFFICIAL_SOURCE, official, official >= 0.9
                        ? "Published on an official government or court domain."
                        : "Not hosted on an official legal source.")
                .signal(JURISDICTION, jurisdiction, jurisdiction >= 0.75
                        ? "References a high-authority jurisdiction."
                        : "Jurisdiction authority unclear.")
                .signal(STATUTE_CITATIONS, statutes, statutes >= 0.4
                        ? "Cites specific statutes or regulations."
                        : "Few statutory references.")
                .signal(RECENCY, recency, recency >= 0.7
                        ? "Relatively current legal text."
                        : "Older legal text; check for amendments.")
                .raw(MetadataKeys.SOURCE_URL, doc.getSourceUrl())
                .raw("statute_families", families)
                .raw(MetadataKeys.PUBLISHED_DATE, published.map(OffsetDateTime::toString).orElse(null))
                .raw("text_year", textYear)
                .build();
    }

    static double officialSource(String url) {
        if (TextUtils.isBlank(url)) return NO_URL;
        String u = url.toLowerCase(Locale.ROOT);
        for (String marker : OFFICIAL_MARKERS) {
            if (u.contains(marker)) return 1.0;
        }
        return OTHER_URL;
    }

    static double jurisdiction(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        double best = -1;
        for (Map.Entry<Pattern, Double> e : JURISDICTIONS.entrySet()) {
            if (e.getKey().matcher(lower).find()) best = Math.max(best, e.getValue());
        }
        return best < 0 ? DEFAULT_JURISDICTION : best;
    }

    static int statuteFamilies(String text) {
        int found = 0;
        for (Pattern p : STATUTE_FAMILIES) {
            if (p.matcher(text).find()) found++;
        }
        return found;
    }

    private static Integer firstYear(String text) {
        Matcher m = YEAR.matcher(text);
        return m.find() ? Integer.valueOf(m.group()) : null;
    }

    private static void keyword(String keyword, double score) {
        JURISDICTIONS.put(Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b"), score);
    }
}
