package com.goormthonuniv.factmerge.lookup;

import java.util.List;

public record PaperMetadata(
        Integer citationCount,         // null = 알 수 없음
        Integer year,
        String venue,
        List<Integer> authorHIndices,
        List<String> publicationTypes, // "JournalArticle", "Conference", ...
        Boolean openAccess
) {
    public PaperMetadata {
        venue = venue == null ? "" : venue;
        authorHIndices = authorHIndices == null ? List.of() : List.copyOf(authorHIndices);
        publicationTypes = publicationTypes == null ? List.of() : List.copyOf(publicationTypes);
    }
}
