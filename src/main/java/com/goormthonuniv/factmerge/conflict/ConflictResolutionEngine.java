package com.goormthonuniv.factmerge.conflict;

import com.goormthonuniv.factmerge.config.ExecutorConfig;
import com.goormthonuniv.factmerge.dto.Claim;
import com.goormthonuniv.factmerge.dto.Conflict;
import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.dto.ResolutionResult;
import com.goormthonuniv.factmerge.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 여러 문서의 주장을 클러스터링하고, 2개 이상 문서에 걸친 클러스터마다 전략을 적용한다.
 */
@Slf4j
@Service
public class ConflictResolutionEngine {

    static final int TOPIC_LENGTH = 80;
    static final double UNRESOLVED_REPRESENTATIVE_CONFIDENCE = 0.4;

    private final ClaimClusterer clusterer;
    private final Executor clusteringExecutor;

    public ConflictResolutionEngine(ClaimClusterer clusterer,
                                    @Qualifier(ExecutorConfig.CLUSTERING_EXECUTOR) Executor clusteringExecutor) {
        this.clusterer = clusterer;
        this.clusteringExecutor = clusteringExecutor;
    }

    public ResolutionResult resolveConflicts(List<Document> documents) {
        return resolveConflicts(documents, null);
    }

    /**
     * @param strategyOverride 전략 이름. null 또는 "auto" 면 지배적 문서 유형의 기본 전략
     */
    public ResolutionResult resolveConflicts(List<Document> documents, String strategyOverride) {
        if (documents == null || documents.isEmpty()) return ResolutionResult.empty();

        // 문서 하나면 교차 출처 불일치가 없다
        if (documents.size() == 1) {
            return new ResolutionResult(documents.get(0).getClaims(), List.of());
        }

        Map<String, Double> credibility = credibilityMap(documents);
        ResolutionStrategy strategy = ResolutionStrategy.resolve(strategyOverride, dominantType(documents));

        List<Claim> allClaims = new ArrayList<>();
        for (Document d : documents) allClaims.addAll(d.getClaims());
        if (allClaims.isEmpty()) return ResolutionResult.empty();

        List<Claim> resolved = new ArrayList<>();
        List<Conflict> conflicts = new ArrayList<>();

        for (List<Claim> cluster : clusterer.cluster(allClaims)) {
            if (cluster.size() == 1) {
                resolved.add(cluster.get(0));
                continue;
            }
            String firstSource = cluster.get(0).sourceDocId();
            boolean singleSource = cluster.stream().allMatch(c -> c.sourceDocId().equals(firstSource));
            if (singleSource) {
                // 같은 문서 안의 반복
                resolved.add(cluster.get(0));
                continue;
            }

            Conflict conflict = strategy.apply(cluster, credibility)
                    .withTopic(TextUtils.topicOf(cluster.get(0).text(), TOPIC_LENGTH));
            conflicts.add(conflict);

            if (conflict.isResolved() && conflict.resolution() != null) {
                resolved.add(new Claim(conflict.resolution(), firstSource, conflict.confidence()));
            } else {
                Claim best = mostCredible(cluster, credibility);
                resolved.add(new Claim(best.text(), best.sourceDocId(), UNRESOLVED_REPRESENTATIVE_CONFIDENCE));
            }
        }

        long unresolved = conflicts.stream().filter(c -> !c.isResolved()).count();
        log.info("[FactMerge] resolved docs={} claims={} -> {} claims, {} conflicts ({} unresolved), strategy={}",
                documents.size(), allClaims.size(), resolved.size(), conflicts.size(), unresolved, strategy.tag());
        return new ResolutionResult(resolved, conflicts);
    }

    public CompletableFuture<ResolutionResult> resolveConflictsAsync(List<Document> documents, String strategyOverride) {
        return CompletableFuture.supplyAsync(() -> resolveConflicts(documents, strategyOverride), clusteringExecutor);
    }

    /** 적용될 전략. 단일 문서 작업은 전략을 쓰지 않는다 */
    public ResolutionStrategy strategyFor(List<Document> documents, String strategyOverride) {
        return ResolutionStrategy.resolve(strategyOverride, dominantType(documents));
    }

    static Map<String, Double> credibilityMap(List<Document> documents) {
        Map<String, Double> m = new HashMap<>();
        for (Document d : documents) {
            CredibilityScore s = d.getCredibilityScore();
            m.put(d.getId(), s == null ? CredibilityScore.NEUTRAL : s.overall());
        }
        return m;
    }

    /** 최빈 유형, 동률이면 먼저 등장한 유형 */
    static DocumentType dominantType(List<Document> documents) {
        Map<DocumentType, Integer> counts = new EnumMap<>(DocumentType.class);
        List<DocumentType> order = new ArrayList<>();
        for (Document d : documents) {
            DocumentType t = d.getType() == null ? DocumentType.UNKNOWN : d.getType();
            if (counts.merge(t, 1, Integer::sum) == 1) order.add(t);
        }
        DocumentType best = DocumentType.UNKNOWN;
        int bestCount = 0;
        for (DocumentType t : order) {
            if (counts.get(t) > bestCount) {
                best = t;
                bestCount = counts.get(t);
            }
        }
        return best;
    }

    private static Claim mostCredible(List<Claim> cluster, Map<String, Double> credibility) {
        Claim best = cluster.get(0);
        for (Claim c : cluster) {
            if (ResolutionStrategy.credibilityOf(c, credibility, 0.0)
                    > ResolutionStrategy.credibilityOf(best, credibility, 0.0)) {
                best = c;
            }
        }
        return best;
    }
}
