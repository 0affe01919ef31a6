package com.goormthonuniv.factmerge.lookup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticScholarAdapterTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void readsFirstPaper() throws Exception {
        String json = """
                {"total": 1, "data": [{
                  "paperId": "abc", "citationCount": 15000, "year": 2022, "venue": "Nature",
                  "authors": [{"hIndex": 55}, {"hIndex": null}],
                  "publicationTypes": ["JournalArticle"], "isOpenAccess": true
                }]}
                """;
        SemanticScholarAdapter.SearchPage page = om.readValue(json, SemanticScholarAdapter.SearchPage.class);

        PaperMetadata p = SemanticScholarAdapter.toMetadata(page).orElseThrow();
        assertThat(p.citationCount()).isEqualTo(15000);
        assertThat(p.year()).isEqualTo(2022);
        assertThat(p.venue()).isEqualTo("Nature");
        assertThat(p.authorHIndices()).containsExactly(55, 0);
        assertThat(p.publicationTypes()).containsExactly("JournalArticle");
    }

    @Test
    void emptyResultIsMiss() throws Exception {
        SemanticScholarAdapter.SearchPage page = om.readValue("{\"total\":0,\"data\":[]}", SemanticScholarAdapter.SearchPage.class);
        assertThat(SemanticScholarAdapter.toMetadata(page)).isEmpty();
        assertThat(SemanticScholarAdapter.toMetadata(null)).isEmpty();
    }

    @Test
    void nullFieldsGetSafeDefaults() {
        PaperMetadata p = new PaperMetadata(null, null, null, null, null, null);
        assertThat(p.venue()).isEmpty();
        assertThat(p.authorHIndices()).isEqualTo(List.of());
    }
}
