package com.goormthonuniv.factmerge.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Component
public class SemanticScholarAdapter implements BibliometricAdapter {

    private static final String FIELDS = "citationCount,year,venue,authors.hIndex,isOpenAccess,publicationTypes";

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;

    public SemanticScholarAdapter(RestClient rest,
                                  @Value("${factmerge.adapters.semanticscholar.endpoint:https://api.semanticscholar.org/graph/v1/paper/search}") String endpoint,
                                  @Value("${factmerge.adapters.semanticscholar.apiKey:}") String apiKey) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override public String name() { return "semantic_scholar"; }

    @Override
    public Optional<PaperMetadata> lookup(String title) {
        if (title == null || title.isBlank()) return Optional.empty();
        try {
            String url = "%s?query=%s&limit=1&fields=%s".formatted(
                    endpoint,
                    URLEncoder.encode(title, StandardCharsets.UTF_8),
                    URLEncoder.encode(FIELDS, StandardCharsets.UTF_8));

            RestClient.RequestHeadersSpec<?> req = rest.get().uri(URI.create(url));
            if (apiKey != null && !apiKey.isBlank()) {
                req = req.header("x-api-key", apiKey);
            }
            SearchPage page = req.retrieve().body(SearchPage.class);
            return toMetadata(page);
        } catch (RestClientException e) {
            log.debug("[FactMerge] adapter={} error={}", name(), e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<PaperMetadata> toMetadata(SearchPage page) {
        if (page == null || page.data == null || page.data.isEmpty()) return Optional.empty();
        Paper p = page.data.get(0);
        if (p == null) return Optional.empty();
        List<Integer> hIndices = p.authors == null ? List.of() : p.authors.stream()
                .filter(Objects::nonNull)
                .map(a -> a.hIndex == null ? 0 : a.hIndex)
                .toList();
        return Optional.of(new PaperMetadata(
                p.citationCount, p.year, p.venue, hIndices, p.publicationTypes, p.isOpenAccess));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchPage {
        public List<Paper> data;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Paper {
        public Integer citationCount;
        public Integer year;
        public String venue;
        public List<Author> authors;
        public List<String> publicationTypes;
        public Boolean isOpenAccess;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Author {
        public Integer hIndex;
    }
}
