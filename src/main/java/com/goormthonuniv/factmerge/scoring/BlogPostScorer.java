package com.goormthonuniv.factmerge.scoring;

import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.llm.LlmJudge;
import com.goormthonuniv.factmerge.util.TextUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
public class BlogPostScorer implements CredibilityScorer {

    public static final String DOMAIN_AUTHORITY = "domain_authority";
    public static final String AUTHOR_CREDENTIALS = "author_credentials";
    public static final String EXTERNAL_REFERENCES = "external_references";
    public static final String RECENCY = "recency";

    public static final Map<String, Double> WEIGHTS = ScoreCard.weights(
            DOMAIN_AUTHORITY, 0.30, AUTHOR_CREDENTIALS, 0.25, EXTERNAL_REFERENCES, 0.25, RECENCY, 0.20);

    static final double OTHER_DOMAIN = 0.45;
    static final double NO_URL = 0.4;
    static final double UNKNOWN_AUTHOR = 0.5;
    static final double NO_LINKS = 0.2;
    static final double PER_LINK = 0.08;
    static final double HALF_LIFE_DAYS = 730.0;
    static final double RECENCY_FLOOR = 0.1;
    static final double UNKNOWN_RECENCY = 0.4;
    static final int AUTHOR_TEXT_BUDGET = 2000;

    private static final Pattern LINK = Pattern.compile("https?://[^\\s)>\"]+");

    private static final Map<String, Double> PLATFORMS = new LinkedHashMap<>();
    static {
        PLATFORMS.put("medium.com", 0.72);
        PLATFORMS.put("substack.com", 0.65);
        PLATFORMS.put("wordpress.com", 0.55);
        PLATFORMS.put("towardsdatascience.com", 0.82);
        PLATFORMS.put("hackernoon.com", 0.75);
        PLATFORMS.put("techcrunch.com", 0.88);
        PLATFORMS.put("wired.com", 0.87);
        PLATFORMS.put("ycombinator.com", 0.90);
    }

    private final LlmJudge llmJudge;
    private final Clock clock;

    @Override
    public DocumentType documentType() {
        return DocumentType.BLOG_POST;
    }

    @Override
    public CredibilityScore score(Document doc) {
        String text = doc.getRawText();

        double domain = domainScore(doc.getSourceUrl());
        double author = llmJudge.rateAuthorCredentials(TextUtils.head(text, AUTHOR_TEXT_BUDGET)).orElse(UNKNOWN_AUTHOR);
        int links = TextUtils.countMatches(LINK, text);
        double references = SignalMath.saturating(links, PER_LINK, NO_LINKS);

        Optional<OffsetDateTime> published = SignalMath.parseDate(doc.getMetadata().get(MetadataKeys.PUBLISHED_DATE));
        double recency = published
                .map(d -> SignalMath.halfLifeDecay(SignalMath.ageDays(d, clock), HALF_LIFE_DAYS, RECENCY_FLOOR))
                .orElse(UNKNOWN_RECENCY);

        return ScoreCard.weighted(WEIGHTS)
                .signal(DOMAIN_AUTHORITY, domain, SignalMath.band(domain, 0.8, 0.55,
                        "Established publishing platform.",
                        "Common blogging platform.",
                        "Unknown or self-hosted site."))
                .signal(AUTHOR_CREDENTIALS, author, SignalMath.band(author, 0.75, 0.45,
                        "Author shows subject-matter expertise.",
                        "Author expertise is unclear.",
                        "Little evidence of author expertise."))
                .signal(EXTERNAL_REFERENCES, references, SignalMath.band(references, 0.5, 0.25,
                        "Well referenced (" + links + " links).",
                        "Some external references (" + links + " links).",
                        "Few or no external references."))
                .signal(RECENCY, recency, published.isEmpty()
                        ? "Publication date unknown."
                        : SignalMath.band(recency, 0.7, 0.4,
                                "Recent post.", "Somewhat dated post.", "Old post."))
                .raw(MetadataKeys.SOURCE_URL, doc.getSourceUrl())
                .raw("link_count", links)
                .raw(MetadataKeys.PUBLISHED_DATE, published.map(OffsetDateTime::toString).orElse(null))
                .build();
    }

    static double domainScore(String url) {
        if (TextUtils.isBlank(url)) return NO_URL;
        String u = url.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> e : PLATFORMS.entrySet()) {
            if (u.contains(e.getKey())) return e.getValue();
        }
        return OTHER_DOMAIN;
    }
}
