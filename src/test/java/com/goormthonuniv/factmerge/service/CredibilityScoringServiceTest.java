package com.goormthonuniv.factmerge.service;

import com.goormthonuniv.factmerge.authority.DomainTrustPersistenceException;
import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.scoring.CredibilityScorer;
import com.goormthonuniv.factmerge.scoring.CredibilityScorerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredibilityScoringServiceTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    /** 문서 id 길이로 점수를 매기는 가짜 채점기 */
    private static CredibilityScorer fake(DocumentType type, double base) {
        return new CredibilityScorer() {
            @Override
            public DocumentType documentType() {
                return type;
            }

            @Override
            public CredibilityScore score(Document doc) {
                if (doc.getId().startsWith("broken")) {
                    throw new DomainTrustPersistenceException("cannot write domain trust cache", null);
                }
                return new CredibilityScore(base, Map.of("x", base), Map.of("x", "fake"), Map.of());
            }
        };
    }

    private CredibilityScoringService service() {
        CredibilityScorerRegistry registry = new CredibilityScorerRegistry(List.of(
                fake(DocumentType.NEWS_ARTICLE, 0.7), fake(DocumentType.LEGAL_DOCUMENT, 0.9)));
        return new CredibilityScoringService(registry, pool);
    }

    @Test
    void scoresEveryDocumentAndWritesBack() {
        Document news = Document.builder().id("n1").type(DocumentType.NEWS_ARTICLE).build();
        Document legal = Document.builder().id("l1").type(DocumentType.LEGAL_DOCUMENT).build();
        Document unknown = Document.builder().id("u1").type(DocumentType.UNKNOWN).build();

        List<CredibilityScore> scores = service().scoreAll(List.of(news, legal, unknown));

        assertThat(scores).extracting(CredibilityScore::overall).containsExactly(0.7, 0.9, 0.7);
        assertThat(legal.getCredibilityScore().overall()).isEqualTo(0.9);
        assertThat(unknown.getCredibilityScore()).isNotNull();
    }

    @Test
    void persistenceFailureSurfaces() {
        Document broken = Document.builder().id("broken-1").type(DocumentType.NEWS_ARTICLE).build();
        Document fine = Document.builder().id("n2").type(DocumentType.NEWS_ARTICLE).build();

        assertThatThrownBy(() -> service().scoreAll(List.of(fine, broken)))
                .isInstanceOf(DomainTrustPersistenceException.class);
    }

    @Test
    void emptyInput() {
        assertThat(service().scoreAll(List.of())).isEmpty();
        assertThat(service().scoreAll(null)).isEmpty();
    }
}
