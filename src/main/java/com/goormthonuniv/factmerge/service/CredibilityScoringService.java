package com.goormthonuniv.factmerge.service;

import com.goormthonuniv.factmerge.config.ExecutorConfig;
import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.scoring.CredibilityScorerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 문서별 채점. scoreAll 은 문서마다 작업 하나씩 풀에 올리고 모두 끝날 때까지 기다린다.
 */
@Slf4j
@Service
public class CredibilityScoringService {

    private final CredibilityScorerRegistry registry;
    private final Executor scoringExecutor;

    public CredibilityScoringService(CredibilityScorerRegistry registry,
                                     @Qualifier(ExecutorConfig.SCORING_EXECUTOR) Executor scoringExecutor) {
        this.registry = registry;
        this.scoringExecutor = scoringExecutor;
    }

    /** 채점 후 문서에 기록하고 돌려준다 */
    public CredibilityScore score(Document doc) {
        CredibilityScore score = registry.forType(doc.getType()).score(doc);
        doc.setCredibilityScore(score);
        log.debug("[FactMerge] doc={} type={} overall={}", doc.getId(), doc.getType(), score.overall());
        return score;
    }

    /**
     * 모든 문서를 병렬 채점. 한 문서라도 예외가 나면 (예: 캐시 저장 실패) 그대로 다시 던진다.
     */
    public List<CredibilityScore> scoreAll(List<Document> docs) {
        if (docs == null || docs.isEmpty()) return List.of();

        List<CompletableFuture<CredibilityScore>> futures = new ArrayList<>(docs.size());
        for (Document d : docs) {
            futures.add(CompletableFuture.supplyAsync(() -> score(d), scoringExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
        List<CredibilityScore> out = new ArrayList<>(futures.size());
        for (CompletableFuture<CredibilityScore> f : futures) out.add(f.join());
        log.info("[FactMerge] scored {} documents", out.size());
        return out;
    }
}
