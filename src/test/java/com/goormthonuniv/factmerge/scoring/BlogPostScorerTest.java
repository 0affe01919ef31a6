package com.goormthonuniv.factmerge.scoring;

import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.llm.LlmJudge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BlogPostScorerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);

    private LlmJudge llm;
    private BlogPostScorer scorer;

    @BeforeEach
    void setUp() {
        llm = mock(LlmJudge.class);
        when(llm.rateAuthorCredentials(anyString())).thenReturn(Optional.empty());
        scorer = new BlogPostScorer(llm, CLOCK);
    }

    @Test
    void wellReferencedPlatformPost() {
        when(llm.rateAuthorCredentials(anyString())).thenReturn(Optional.of(0.8));
        StringBuilder text = new StringBuilder("I have worked on distributed databases for ten years.\n");
        for (int i = 0; i < 13; i++) text.append("See https://example.org/ref/").append(i).append(" for details.\n");

        CredibilityScore s = scorer.score(blog("https://medium.com/@author/post-1", text.toString(),
                Map.of(MetadataKeys.PUBLISHED_DATE, "2024-03-01T00:00:00Z")));

        assertThat(s.breakdown())
                .containsEntry(BlogPostScorer.DOMAIN_AUTHORITY, 0.72)
                .containsEntry(BlogPostScorer.AUTHOR_CREDENTIALS, 0.8)
                .containsEntry(BlogPostScorer.EXTERNAL_REFERENCES, 1.0);
        assertThat(s.breakdown().get(BlogPostScorer.RECENCY)).isBetween(0.49, 0.51);
        assertThat(s.signals()).containsEntry("link_count", 13);
        ResearchPaperScorerTest.assertConvex(s, BlogPostScorer.WEIGHTS);
    }

    @Test
    void defaultsWhenNothingIsKnown() {
        CredibilityScore s = scorer.score(blog(null, "Just my thoughts on the matter today.", Map.of()));

        assertThat(s.breakdown())
                .containsEntry(BlogPostScorer.DOMAIN_AUTHORITY, 0.4)
                .containsEntry(BlogPostScorer.AUTHOR_CREDENTIALS, 0.5)
                .containsEntry(BlogPostScorer.EXTERNAL_REFERENCES, 0.2)
                .containsEntry(BlogPostScorer.RECENCY, 0.4);
    }

    @Test
    void singleLinkScoresBelowZeroLinkFloor() {
        CredibilityScore s = scorer.score(blog("https://someone.dev/post", "Source: https://example.org/a", Map.of()));
        assertThat(s.breakdown())
                .containsEntry(BlogPostScorer.DOMAIN_AUTHORITY, 0.45)
                .containsEntry(BlogPostScorer.EXTERNAL_REFERENCES, 0.08);
    }

    private static Document blog(String url, String text, Map<String, Object> metadata) {
        return Document.builder()
                .type(DocumentType.BLOG_POST)
                .sourceUrl(url)
                .rawText(text)
                .metadata(metadata)
                .build();
    }
}
