package com.goormthonuniv.factmerge.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * 문장 → 단위 길이 벡터. 같은 프로바이더가 낸 벡터끼리만 비교 가능하다.
 */
public interface EmbeddingProvider {

    String name();

    double[] embed(String text);

    default List<double[]> embedAll(List<String> texts) {
        List<double[]> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(embed(t));
        return out;
    }

    /** 두 벡터의 코사인 유사도. 영벡터가 끼면 0 */
    static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
