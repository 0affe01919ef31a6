package com.goormthonuniv.factmerge.conflict;

import com.goormthonuniv.factmerge.dto.Claim;
import com.goormthonuniv.factmerge.embedding.EmbeddingProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 의미가 같은 주장끼리 묶는다. 시드(클러스터 첫 주장)와의 코사인만 비교하는 탐욕적 방식이라
 * 결과는 입력 순서에 따라 달라지고, A~B, B~C 여도 A,C 가 같은 클러스터라는 보장은 없다.
 * 반환값은 입력의 분할이다 (모든 주장이 정확히 한 클러스터에 속함).
 */
@Slf4j
@Component
public class ClaimClusterer {

    public static final double DEFAULT_THRESHOLD = 0.82;

    private final EmbeddingProvider embeddings;
    private final double threshold;

    public ClaimClusterer(EmbeddingProvider embeddings,
                          @Value("${factmerge.clustering.threshold:0.82}") double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("clustering threshold must be in [0,1]: " + threshold);
        }
        this.embeddings = embeddings;
        this.threshold = threshold;
    }

    public List<List<Claim>> cluster(List<Claim> claims) {
        if (claims == null || claims.isEmpty()) return List.of();

        List<double[]> vectors = embeddings.embedAll(claims.stream().map(Claim::text).toList());
        boolean[] assigned = new boolean[claims.size()];
        List<List<Claim>> clusters = new ArrayList<>();

        for (int i = 0; i < claims.size(); i++) {
            if (assigned[i]) continue;
            assigned[i] = true;
            List<Claim> cluster = new ArrayList<>();
            cluster.add(claims.get(i));
            for (int j = i + 1; j < claims.size(); j++) {
                if (assigned[j]) continue;
                if (EmbeddingProvider.cosine(vectors.get(i), vectors.get(j)) >= threshold) {
                    cluster.add(claims.get(j));
                    assigned[j] = true;
                }
            }
            clusters.add(cluster);
        }
        log.debug("[FactMerge] clustered {} claims into {} groups (threshold={}, provider={})",
                claims.size(), clusters.size(), threshold, embeddings.name());
        return clusters;
    }

    public double threshold() {
        return threshold;
    }
}
