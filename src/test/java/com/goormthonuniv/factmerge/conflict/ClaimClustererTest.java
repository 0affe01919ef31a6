package com.goormthonuniv.factmerge.conflict;

import com.goormthonuniv.factmerge.dto.Claim;
import com.goormthonuniv.factmerge.embedding.EmbeddingProvider;
import com.goormthonuniv.factmerge.embedding.TermVectorEmbeddingProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClaimClustererTest {

    /** 텍스트 → 고정 2차원 단위 벡터 */
    private static EmbeddingProvider fixed(Map<String, double[]> vectors) {
        return new EmbeddingProvider() {
            @Override
            public String name() {
                return "fixed";
            }

            @Override
            public double[] embed(String text) {
                return vectors.get(text);
            }
        };
    }

    private static double[] angle(double degrees) {
        double r = Math.toRadians(degrees);
        return new double[]{Math.cos(r), Math.sin(r)};
    }

    @Test
    void comparesOnlyAgainstSeed() {
        // a~b (cos 30° ≈ 0.87), b~c (0.87), a~c (0.5)
        ClaimClusterer clusterer = new ClaimClusterer(
                fixed(Map.of("a", angle(0), "b", angle(30), "c", angle(60))), ClaimClusterer.DEFAULT_THRESHOLD);
        Claim a = new Claim("a", "d1");
        Claim b = new Claim("b", "d2");
        Claim c = new Claim("c", "d3");

        List<List<Claim>> clusters = clusterer.cluster(List.of(a, b, c));

        assertThat(clusters).containsExactly(List.of(a, b), List.of(c));
    }

    @Test
    void orderChangesGrouping() {
        ClaimClusterer clusterer = new ClaimClusterer(
                fixed(Map.of("a", angle(0), "b", angle(30), "c", angle(60))), ClaimClusterer.DEFAULT_THRESHOLD);
        Claim a = new Claim("a", "d1");
        Claim b = new Claim("b", "d2");
        Claim c = new Claim("c", "d3");

        assertThat(clusterer.cluster(List.of(b, a, c))).containsExactly(List.of(b, a, c));
    }

    @Test
    void resultIsPartitionOfInput() {
        ClaimClusterer clusterer = new ClaimClusterer(new TermVectorEmbeddingProvider(), 0.82);
        List<Claim> claims = List.of(
                new Claim("Global solar capacity reached 1.6 terawatts in 2023.", "d1"),
                new Claim("Global solar capacity reached 1.6 terawatts in 2023.", "d2"),
                new Claim("Coal consumption fell in Europe last year.", "d1"),
                new Claim("The central bank raised interest rates.", "d3"));

        List<List<Claim>> clusters = clusterer.cluster(claims);

        List<Claim> flattened = new ArrayList<>();
        clusters.forEach(flattened::addAll);
        assertThat(flattened).containsExactlyInAnyOrderElementsOf(claims);
        assertThat(clusters).hasSize(3);
        assertThat(clusterer.cluster(List.of())).isEmpty();
    }

    @Test
    void thresholdMustBeInUnitRange() {
        assertThatThrownBy(() -> new ClaimClusterer(new TermVectorEmbeddingProvider(), 1.2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
