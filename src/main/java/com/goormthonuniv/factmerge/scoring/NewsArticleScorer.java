package com.goormthonuniv.factmerge.scoring;

import com.goormthonuniv.factmerge.authority.DomainTrustPolicy;
import com.goormthonuniv.factmerge.authority.SourceAuthorityResolver;
import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.util.TextUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 뉴스 기사 채점. 유형을 알 수 없는 문서도 이 채점기가 맡는다.
 */
@Component
@RequiredArgsConstructor
public class NewsArticleScorer implements CredibilityScorer {

    public static final String SOURCE_TRUST = "source_trust";
    public static final String RECENCY = "recency";
    public static final String PRIMARY_CITATIONS = "primary_citations";
    public static final String CORROBORATION = "corroboration";
    public static final String BYLINE = "byline";

    public static final Map<String, Double> WEIGHTS = ScoreCard.weights(
            SOURCE_TRUST, 0.40, RECENCY, 0.20, PRIMARY_CITATIONS, 0.15, CORROBORATION, 0.15, BYLINE, 0.10);

    static final double HALF_LIFE_DAYS = 365.0;
    static final double RECENCY_FLOOR = 0.1;
    static final double UNKNOWN = 0.5;
    static final double CITATION_FLOOR = 0.2;
    static final double BYLINE_PRESENT = 0.9;
    static final double BYLINE_ABSENT = 0.3;

    private static final Pattern QUOTE = Pattern.compile("\"[^\"]{20,}\"|“[^”]{20,}”");
    private static final Pattern NAMED_SOURCE =
            Pattern.compile("(?:said|told|according\\s+to|stated|confirmed)\\s+[A-Z]");
    private static final Pattern BYLINE_PATTERN =
            Pattern.compile("\\bBy\\s+[A-Z][a-z]+\\s+[A-Z][a-z]+|\\bReported\\s+by\\b|\\bStaff\\s+Writer\\b");

    private final SourceAuthorityResolver resolver;
    private final DomainTrustPolicy policy;
    private final Clock clock;

    @Override
    public DocumentType documentType() {
        return DocumentType.NEWS_ARTICLE;
    }

    @Override
    public CredibilityScore score(Document doc) {
        Map<String, Object> meta = doc.getMetadata();
        String text = doc.getRawText();

        double trust = sourceTrust(doc);
        meta.put(MetadataKeys.SOURCE_TRUST_SCORE, trust);

        Optional<OffsetDateTime> published = SignalMath.parseDate(meta.get(MetadataKeys.PUBLISHED_DATE));
        double recency = published
                .map(d -> SignalMath.halfLifeDecay(SignalMath.ageDays(d, clock), HALF_LIFE_DAYS, RECENCY_FLOOR))
                .orElse(UNKNOWN);

        int quotes = TextUtils.countMatches(QUOTE, text);
        int named = TextUtils.countMatches(NAMED_SOURCE, text);
        double citations = Math.max(Math.min(quotes * 0.1 + named * 0.08, 1.0), CITATION_FLOOR);

        double corroboration = SignalMath.parseDouble(meta.get(MetadataKeys.CORROBORATION_SCORE))
                .map(SignalMath::clamp01)
                .orElse(UNKNOWN);

        boolean hasByline = text != null && BYLINE_PATTERN.matcher(text).find();
        double byline = hasByline ? BYLINE_PRESENT : BYLINE_ABSENT;

        return ScoreCard.weighted(WEIGHTS)
                .signal(SOURCE_TRUST, trust, SignalMath.band(trust, 0.85, 0.6,
                        "Highly trusted news outlet.",
                        "Generally reliable outlet.",
                        "Outlet with a weak or unknown track record."))
                .signal(RECENCY, recency, published.isEmpty()
                        ? "Publication date unknown."
                        : SignalMath.band(recency, 0.8, 0.5,
                                "Recently published.", "Published within the last few years.", "Older article."))
                .signal(PRIMARY_CITATIONS, citations, SignalMath.band(citations, 0.5, 0.3,
                        "Quotes and attributes primary sources.",
                        "Some sourcing present.",
                        "Little direct sourcing (" + quotes + " quotes, " + named + " attributions)."))
                .signal(CORROBORATION, corroboration, "Corroboration across outlets: " + SignalMath.percent(corroboration) + "%.")
                .signal(BYLINE, byline, byline >= 0.8 ? "Named author byline present." : "No clear byline.")
                .raw(MetadataKeys.SOURCE_URL, doc.getSourceUrl())
                .raw(MetadataKeys.PUBLISHER, meta.get(MetadataKeys.PUBLISHER))
                .raw(MetadataKeys.PUBLISHED_DATE, published.map(OffsetDateTime::toString).orElse(null))
                .raw("quote_count", quotes)
                .raw("named_source_count", named)
                .build();
    }

    /** URL 이 있으면 권위 리졸버, 없으면 발행처 이름 매칭, 그것도 없으면 0.5 */
    private double sourceTrust(Document doc) {
        if (!TextUtils.isBlank(doc.getSourceUrl())) {
            return resolver.resolve(doc.getSourceUrl());
        }
        Object publisher = doc.getMetadata().get(MetadataKeys.PUBLISHER);
        if (publisher != null && !publisher.toString().isBlank()) {
            return policy.publisherScore(publisher.toString()).orElse(UNKNOWN);
        }
        return UNKNOWN;
    }
}
