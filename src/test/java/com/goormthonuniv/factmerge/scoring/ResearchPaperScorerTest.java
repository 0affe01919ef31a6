package com.goormthonuniv.factmerge.scoring;

import com.goormthonuniv.factmerge.authority.DomainTrustPolicy;
import com.goormthonuniv.factmerge.authority.InMemoryDomainTrustRepository;
import com.goormthonuniv.factmerge.authority.SourceAuthorityResolver;
import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.llm.LlmJudge;
import com.goormthonuniv.factmerge.lookup.BibliometricAdapter;
import com.goormthonuniv.factmerge.lookup.PaperMetadata;
import com.goormthonuniv.factmerge.lookup.PopularityIndexAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ResearchPaperScorerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);

    private BibliometricAdapter bibliometric;
    private ResearchPaperScorer scorer;

    @BeforeEach
    void setUp() {
        PopularityIndexAdapter popularity = mock(PopularityIndexAdapter.class);
        LlmJudge llm = mock(LlmJudge.class);
        when(popularity.authority(anyString())).thenReturn(Optional.empty());
        when(llm.rateDomain(anyString())).thenReturn(Optional.empty());
        SourceAuthorityResolver resolver = new SourceAuthorityResolver(
                new DomainTrustPolicy(), new InMemoryDomainTrustRepository(CLOCK), popularity, llm);
        bibliometric = mock(BibliometricAdapter.class);
        when(bibliometric.lookup(anyString())).thenReturn(Optional.empty());
        scorer = new ResearchPaperScorer(resolver, bibliometric, CLOCK);
    }

    @Test
    void highlyCitedNaturePaperScoresHigh() {
        when(bibliometric.lookup("Global warming trends")).thenReturn(Optional.of(new PaperMetadata(
                15000, 2022, "Nature", List.of(12, 55), List.of("JournalArticle"), true)));
        Document doc = paper("Global warming trends", "https://www.nature.com/articles/s41586-022-0001");

        CredibilityScore s = scorer.score(doc);

        assertThat(s.overall()).isGreaterThanOrEqualTo(0.85);
        assertThat(s.breakdown().keySet()).isEqualTo(ResearchPaperScorer.ACADEMIC_WEIGHTS.keySet());
        assertThat(s.breakdown()).containsEntry(ResearchPaperScorer.SOURCE_AUTHORITY, 0.97)
                .containsEntry(ResearchPaperScorer.VENUE, 1.0)
                .containsEntry(ResearchPaperScorer.CITATIONS, 1.0);
        assertThat(s.signals()).containsEntry(MetadataKeys.SCORING_METHOD, ResearchPaperScorer.MODE_ACADEMIC)
                .containsEntry("citation_count_raw", 15000);
        assertThat(doc.getMetadata())
                .containsEntry(MetadataKeys.CITATIONS, 15000)
                .containsEntry(MetadataKeys.YEAR, 2022)
                .containsEntry(MetadataKeys.PEER_REVIEWED, true)
                .containsEntry(MetadataKeys.SOURCE_AUTHORITY, 0.97);
        assertConvex(s, ResearchPaperScorer.ACADEMIC_WEIGHTS);
    }

    @Test
    void missingAcademicDataWithUrlUsesAuthorityOnly() {
        CredibilityScore s = scorer.score(paper("Obscure study", "https://eaps.mit.edu/papers/1"));

        assertThat(s.signals()).containsEntry(MetadataKeys.SCORING_METHOD, ResearchPaperScorer.MODE_AUTHORITY_ONLY);
        assertThat(s.breakdown()).containsOnlyKeys(ResearchPaperScorer.SOURCE_AUTHORITY, ResearchPaperScorer.RECENCY);
        assertThat(s.overall()).isCloseTo(0.65 * 0.88 + 0.35 * 0.5, within(1e-4));
    }

    @Test
    void noDataAndNoUrlUsesFixedAuthority() {
        CredibilityScore s = scorer.score(paper("Untraceable manuscript", null));

        assertThat(s.signals()).containsEntry(MetadataKeys.SCORING_METHOD, ResearchPaperScorer.MODE_UNKNOWN);
        assertThat(s.breakdown()).containsEntry(ResearchPaperScorer.SOURCE_AUTHORITY, 0.4);
        assertThat(s.overall()).isCloseTo(0.435, within(1e-4));
    }

    @Test
    void unknownCitationsAndVenueScoreZero() {
        when(bibliometric.lookup(anyString())).thenReturn(Optional.of(new PaperMetadata(
                null, null, null, null, null, null)));
        CredibilityScore s = scorer.score(paper("Some paper", null));

        assertThat(s.breakdown()).containsEntry(ResearchPaperScorer.CITATIONS, 0.0)
                .containsEntry(ResearchPaperScorer.VENUE, 0.0)
                .containsEntry(ResearchPaperScorer.H_INDEX, 0.0)
                .containsEntry(ResearchPaperScorer.RECENCY, 0.5)
                .containsEntry(ResearchPaperScorer.SOURCE_AUTHORITY, 0.5);
    }

    @Test
    void queriesWithTextHeadWhenTitleMissing() {
        String text = "x".repeat(250);
        Document doc = Document.builder().type(DocumentType.RESEARCH_PAPER).rawText(text).build();

        scorer.score(doc);

        verify(bibliometric).lookup("x".repeat(200));
    }

    @Test
    void immutableMetadataStillReceivesLookupValues() {
        when(bibliometric.lookup("Ocean heat content")).thenReturn(Optional.of(new PaperMetadata(
                40, 2020, "PLOS ONE", List.of(8), List.of("JournalArticle"), true)));
        Document doc = Document.builder()
                .type(DocumentType.RESEARCH_PAPER)
                .title("Ocean heat content")
                .sourceUrl("https://journals.plos.org/plosone/article?id=1")
                .metadata(Map.of("submitted_by", "intake"))
                .build();

        CredibilityScore s = scorer.score(doc);

        assertThat(s.breakdown()).containsOnlyKeys("source_authority", "venue_tier", "citation_count",
                "recency", "author_hindex");
        assertThat(doc.getMetadata())
                .containsEntry("submitted_by", "intake")
                .containsEntry(MetadataKeys.CITATIONS, 40)
                .containsEntry(MetadataKeys.VENUE, "PLOS ONE");
    }

    @Test
    void venueTiers() {
        assertThat(ResearchPaperScorer.venueScore("The Lancet")).isEqualTo(0.97);
        assertThat(ResearchPaperScorer.venueScore("arXiv")).isEqualTo(0.5);
        assertThat(ResearchPaperScorer.venueScore("Journal of Niche Studies")).isEqualTo(0.55);
        assertThat(ResearchPaperScorer.venueScore("")).isEqualTo(0.0);
    }

    private static Document paper(String title, String url) {
        return Document.builder()
                .type(DocumentType.RESEARCH_PAPER)
                .title(title)
                .sourceUrl(url)
                .rawText("Abstract. We measure things carefully and report results.")
                .build();
    }

    static void assertConvex(CredibilityScore s, Map<String, Double> weights) {
        double sum = 0;
        for (Map.Entry<String, Double> w : weights.entrySet()) sum += w.getValue() * s.breakdown().get(w.getKey());
        assertThat(s.overall()).isCloseTo(SignalMath.round4(sum), within(1e-9));
    }
}
