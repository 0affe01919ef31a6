package com.goormthonuniv.factmerge.scoring;

import com.goormthonuniv.factmerge.dto.CredibilityScore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 가중치 테이블 하나에 대한 신호 값/설명 모음.
 * overall 은 저장되는(4자리 반올림된) breakdown 값들의 볼록 결합이다.
 */
public final class ScoreCard {

    static final double WEIGHT_TOLERANCE = 1e-9;

    private final Map<String, Double> weights;
    private final Map<String, Double> breakdown = new LinkedHashMap<>();
    private final Map<String, String> explanations = new LinkedHashMap<>();
    private final Map<String, Object> signals = new LinkedHashMap<>();

    private ScoreCard(Map<String, Double> weights) {
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("weights must sum to 1.0 but sum to " + sum + ": " + weights);
        }
        this.weights = weights;
    }

    /** (신호명, 가중치) 쌍을 순서 유지 불변 맵으로 */
    public static Map<String, Double> weights(Object... pairs) {
        if (pairs.length % 2 != 0) throw new IllegalArgumentException("name/weight pairs expected");
        Map<String, Double> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((String) pairs[i], ((Number) pairs[i + 1]).doubleValue());
        }
        return Collections.unmodifiableMap(m);
    }

    public static ScoreCard weighted(Map<String, Double> weights) {
        return new ScoreCard(weights);
    }

    public ScoreCard signal(String name, double value, String explanation) {
        if (!weights.containsKey(name)) {
            throw new IllegalArgumentException("no weight for signal " + name);
        }
        breakdown.put(name, SignalMath.round4(SignalMath.clamp01(value)));
        explanations.put(name, explanation);
        return this;
    }

    public ScoreCard raw(String key, Object value) {
        signals.put(key, value);
        return this;
    }

    public CredibilityScore build() {
        double overall = 0.0;
        for (Map.Entry<String, Double> w : weights.entrySet()) {
            Double v = breakdown.get(w.getKey());
            if (v == null) {
                throw new IllegalStateException("missing signal " + w.getKey());
            }
            overall += w.getValue() * v;
        }
        return new CredibilityScore(SignalMath.round4(SignalMath.clamp01(overall)), breakdown, explanations, signals);
    }
}
