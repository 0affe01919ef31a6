package com.goormthonuniv.factmerge.embedding;

import com.goormthonuniv.factmerge.util.TextUtils;

/**
 * 네트워크 없이 쓰는 해시 TF 벡터. 토큰을 고정 차원 버킷으로 해싱해 단위 벡터로 만든다.
 * 의미 유사도가 아니라 어휘 겹침만 본다.
 */
public class TermVectorEmbeddingProvider implements EmbeddingProvider {

    public static final int DEFAULT_DIMENSION = 512;

    private final int dimension;

    public TermVectorEmbeddingProvider() {
        this(DEFAULT_DIMENSION);
    }

    public TermVectorEmbeddingProvider(int dimension) {
        if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
        this.dimension = dimension;
    }

    @Override
    public String name() {
        return "term_vector";
    }

    @Override
    public double[] embed(String text) {
        double[] v = new double[dimension];
        for (String t : TextUtils.tokens(text)) {
            v[Math.floorMod(t.hashCode(), dimension)] += 1.0;
        }
        return unit(v);
    }

    static double[] unit(double[] v) {
        double norm = 0;
        for (double x : v) norm += x * x;
        if (norm == 0) return v;
        norm = Math.sqrt(norm);
        for (int i = 0; i < v.length; i++) v[i] /= norm;
        return v;
    }
}
