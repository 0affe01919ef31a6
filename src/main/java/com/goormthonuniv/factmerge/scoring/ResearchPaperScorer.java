package com.goormthonuniv.factmerge.scoring;

import com.goormthonuniv.factmerge.authority.SourceAuthorityResolver;
import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.lookup.BibliometricAdapter;
import com.goormthonuniv.factmerge.lookup.PaperMetadata;
import com.goormthonuniv.factmerge.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 논문 채점. 서지 조회 결과 유무와 URL 유무에 따라 세 가지 모드로 나뉜다.
 * <ul>
 *     <li>academic_blend: 서지 데이터 있음</li>
 *     <li>authority_only: 서지 데이터 없음, URL 있음</li>
 *     <li>unknown: 둘 다 없음. 권위 항목은 고정값 0.4</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResearchPaperScorer implements CredibilityScorer {

    public static final String SOURCE_AUTHORITY = "source_authority";
    public static final String VENUE = "venue_tier";
    public static final String CITATIONS = "citation_count";
    public static final String RECENCY = "recency";
    public static final String H_INDEX = "author_hindex";

    public static final String MODE_ACADEMIC = "academic_blend";
    public static final String MODE_AUTHORITY_ONLY = "authority_only";
    public static final String MODE_UNKNOWN = "unknown";

    public static final Map<String, Double> ACADEMIC_WEIGHTS = ScoreCard.weights(
            SOURCE_AUTHORITY, 0.30, VENUE, 0.25, CITATIONS, 0.20, RECENCY, 0.15, H_INDEX, 0.10);
    public static final Map<String, Double> AUTHORITY_ONLY_WEIGHTS = ScoreCard.weights(
            SOURCE_AUTHORITY, 0.65, RECENCY, 0.35);
    public static final Map<String, Double> UNKNOWN_WEIGHTS = AUTHORITY_ONLY_WEIGHTS;

    static final double UNKNOWN_AUTHORITY = 0.4;
    static final int CITATION_CAP = 5000;
    static final double H_INDEX_MAX = 60.0;
    static final double HALF_LIFE_YEARS = 5.0;
    static final double UNKNOWN_RECENCY = 0.5;
    static final double OTHER_VENUE = 0.55;
    static final int QUERY_FALLBACK_CHARS = 200;

    // 부분 문자열 매칭, 먼저 나온 항목 우선
    private static final Map<String, Double> VENUE_TIERS = new LinkedHashMap<>();
    static {
        VENUE_TIERS.put("nature", 1.0);
        VENUE_TIERS.put("science", 1.0);
        VENUE_TIERS.put("cell", 0.98);
        VENUE_TIERS.put("lancet", 0.97);
        VENUE_TIERS.put("nejm", 0.97);
        VENUE_TIERS.put("jama", 0.96);
        VENUE_TIERS.put("ieee", 0.85);
        VENUE_TIERS.put("acm", 0.82);
        VENUE_TIERS.put("plos", 0.75);
        VENUE_TIERS.put("arxiv", 0.5);
        VENUE_TIERS.put("biorxiv", 0.45);
        VENUE_TIERS.put("preprint", 0.35);
    }

    private final SourceAuthorityResolver resolver;
    private final BibliometricAdapter bibliometric;
    private final Clock clock;

    @Override
    public DocumentType documentType() {
        return DocumentType.RESEARCH_PAPER;
    }

    @Override
    public CredibilityScore score(Document doc) {
        String query = TextUtils.isBlank(doc.getTitle())
                ? TextUtils.head(doc.getRawText(), QUERY_FALLBACK_CHARS)
                : doc.getTitle();
        Optional<PaperMetadata> paper = TextUtils.isBlank(query) ? Optional.empty() : bibliometric.lookup(query);
        boolean hasUrl = !TextUtils.isBlank(doc.getSourceUrl());

        if (paper.isPresent()) return academic(doc, paper.get());
        if (hasUrl) return authorityOnly(doc);
        return unknown(doc);
    }

    private CredibilityScore academic(Document doc, PaperMetadata p) {
        double authority = resolver.resolve(doc.getSourceUrl());
        double venue = venueScore(p.venue());
        double citations = SignalMath.logScaled(p.citationCount(), CITATION_CAP);
        double recency = yearRecency(p.year());
        double hIndex = hIndexScore(p);
        boolean peerReviewed = isPeerReviewed(p);

        Map<String, Object> meta = doc.getMetadata();
        meta.put(MetadataKeys.CITATIONS, p.citationCount());
        meta.put(MetadataKeys.YEAR, p.year());
        meta.put(MetadataKeys.VENUE, p.venue());
        meta.put(MetadataKeys.PEER_REVIEWED, peerReviewed);
        meta.put(MetadataKeys.SOURCE_AUTHORITY, authority);

        log.debug("[FactMerge] research doc={} mode={} citations={} venue={}",
                doc.getId(), MODE_ACADEMIC, p.citationCount(), p.venue());

        return ScoreCard.weighted(ACADEMIC_WEIGHTS)
                .signal(SOURCE_AUTHORITY, authority, authorityExplanation(authority))
                .signal(VENUE, venue, venueExplanation(p.venue(), venue))
                .signal(CITATIONS, citations, citationExplanation(p.citationCount()))
                .signal(RECENCY, recency, yearExplanation(p.year()))
                .signal(H_INDEX, hIndex, hIndexExplanation(p))
                .raw("citation_count_raw", p.citationCount())
                .raw("publication_year", p.year())
                .raw(MetadataKeys.VENUE, p.venue())
                .raw(MetadataKeys.PEER_REVIEWED, peerReviewed)
                .raw(MetadataKeys.SOURCE_URL, doc.getSourceUrl())
                .raw(MetadataKeys.SCORING_METHOD, MODE_ACADEMIC)
                .build();
    }

    private CredibilityScore authorityOnly(Document doc) {
        double authority = resolver.resolve(doc.getSourceUrl());
        doc.getMetadata().put(MetadataKeys.SOURCE_AUTHORITY, authority);
        return ScoreCard.weighted(AUTHORITY_ONLY_WEIGHTS)
                .signal(SOURCE_AUTHORITY, authority, authorityExplanation(authority))
                .signal(RECENCY, UNKNOWN_RECENCY, "Publication date not available from an academic index.")
                .raw(MetadataKeys.SOURCE_URL, doc.getSourceUrl())
                .raw(MetadataKeys.SCORING_METHOD, MODE_AUTHORITY_ONLY)
                .build();
    }

    private CredibilityScore unknown(Document doc) {
        doc.getMetadata().put(MetadataKeys.SOURCE_AUTHORITY, UNKNOWN_AUTHORITY);
        return ScoreCard.weighted(UNKNOWN_WEIGHTS)
                .signal(SOURCE_AUTHORITY, UNKNOWN_AUTHORITY, "No source URL or academic record; authority assumed low.")
                .signal(RECENCY, UNKNOWN_RECENCY, "Publication date unknown.")
                .raw(MetadataKeys.SOURCE_URL, null)
                .raw(MetadataKeys.SCORING_METHOD, MODE_UNKNOWN)
                .build();
    }

    static double venueScore(String venue) {
        if (TextUtils.isBlank(venue)) return 0.0;
        String v = venue.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> e : VENUE_TIERS.entrySet()) {
            if (v.contains(e.getKey())) return e.getValue();
        }
        return OTHER_VENUE;
    }

    static double hIndexScore(PaperMetadata p) {
        if (p.authorHIndices().isEmpty()) return 0.0;
        int max = p.authorHIndices().stream().mapToInt(Integer::intValue).max().orElse(0);
        return Math.min(max / H_INDEX_MAX, 1.0);
    }

    static boolean isPeerReviewed(PaperMetadata p) {
        return p.publicationTypes().contains("JournalArticle")
                || p.publicationTypes().contains("Conference")
                || p.venue().toLowerCase(Locale.ROOT).contains("journal");
    }

    private double yearRecency(Integer year) {
        if (year == null) return UNKNOWN_RECENCY;
        int age = LocalDate.now(clock).getYear() - year;
        return SignalMath.halfLifeDecay(age, HALF_LIFE_YEARS, 0.0);
    }

    private static String authorityExplanation(double a) {
        return SignalMath.band(a, 0.85, 0.6,
                "Published through a highly authoritative source.",
                "Published through a reasonably authoritative source.",
                "Source authority is limited or unverified.");
    }

    private static String venueExplanation(String venue, double score) {
        if (TextUtils.isBlank(venue)) return "Publication venue unknown.";
        return SignalMath.band(score, 0.9, 0.6,
                "Top-tier venue (" + venue + ").",
                "Recognized venue (" + venue + ").",
                "Lower-tier or preprint venue (" + venue + ").");
    }

    private static String citationExplanation(Integer count) {
        if (count == null) return "Citation count unavailable.";
        if (count >= 1000) return "Highly cited (" + count + " citations).";
        if (count >= 50) return "Moderately cited (" + count + " citations).";
        return "Few citations (" + count + ").";
    }

    private static String yearExplanation(Integer year) {
        return year == null ? "Publication year unknown." : "Published in " + year + ".";
    }

    private static String hIndexExplanation(PaperMetadata p) {
        if (p.authorHIndices().isEmpty()) return "Author h-index unavailable.";
        int max = p.authorHIndices().stream().mapToInt(Integer::intValue).max().orElse(0);
        return "Highest author h-index is " + max + ".";
    }
}
