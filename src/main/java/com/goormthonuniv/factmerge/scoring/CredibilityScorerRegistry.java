package com.goormthonuniv.factmerge.scoring;

import com.goormthonuniv.factmerge.dto.DocumentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 문서 유형 → 채점기. 등록되지 않은 유형(UNKNOWN 포함)은 뉴스 채점기로 간다.
 */
@Slf4j
@Component
public class CredibilityScorerRegistry {

    private static final DocumentType FALLBACK = DocumentType.NEWS_ARTICLE;

    private final Map<DocumentType, CredibilityScorer> scorers = new EnumMap<>(DocumentType.class);

    public CredibilityScorerRegistry(List<CredibilityScorer> scorers) {
        for (CredibilityScorer s : scorers) {
            CredibilityScorer prev = this.scorers.put(s.documentType(), s);
            if (prev != null) {
                throw new IllegalStateException("duplicate scorer for " + s.documentType().tag());
            }
        }
        if (!this.scorers.containsKey(FALLBACK)) {
            throw new IllegalStateException("no scorer registered for " + FALLBACK.tag());
        }
        log.info("[FactMerge] scorers registered: {}", this.scorers.keySet());
    }

    public CredibilityScorer forType(DocumentType type) {
        CredibilityScorer s = type == null ? null : scorers.get(type);
        return s != null ? s : scorers.get(FALLBACK);
    }
}
