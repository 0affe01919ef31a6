package com.goormthonuniv.factmerge.service;

import com.goormthonuniv.factmerge.conflict.ConflictResolutionEngine;
import com.goormthonuniv.factmerge.dto.AnalysisReport;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.dto.ResolutionResult;
import com.goormthonuniv.factmerge.extract.ClaimExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 한 작업 단위: 채점 → 주장 추출 → 충돌 해결.
 * 저장과 요약은 호출자 몫이다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisPipeline {

    public static final String NO_STRATEGY = "none";

    private final CredibilityScoringService scoringService;
    private final ClaimExtractor claimExtractor;
    private final ConflictResolutionEngine engine;

    public AnalysisReport analyze(List<Document> docs) {
        return analyze(docs, null);
    }

    /**
     * @param strategyOverride 전략 이름, null 또는 "auto" 면 유형별 기본값
     */
    public AnalysisReport analyze(List<Document> docs, String strategyOverride) {
        List<Document> input = docs == null ? List.of() : docs;

        scoringService.scoreAll(input);
        for (Document d : input) {
            d.setClaims(new ArrayList<>(claimExtractor.extract(d)));
        }

        ResolutionResult result = engine.resolveConflicts(input, strategyOverride);
        String strategy = input.size() < 2
                ? NO_STRATEGY
                : engine.strategyFor(input, strategyOverride).tag();

        Set<DocumentType> types = new LinkedHashSet<>();
        List<String> ids = new ArrayList<>();
        for (Document d : input) {
            types.add(d.getType());
            ids.add(d.getId());
        }

        log.info("[FactMerge] analysis docs={} types={} claims={} conflicts={} strategy={}",
                ids.size(), types, result.resolvedClaims().size(), result.conflicts().size(), strategy);
        return new AnalysisReport(ids, result.resolvedClaims(), result.conflicts(), List.copyOf(types), strategy);
    }
}
