package com.goormthonuniv.factmerge.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CredibilityScore(
        double overall,                    // 0.0~1.0, breakdown 의 가중 합
        Map<String, Double> breakdown,     // 신호명 -> 0.0~1.0
        Map<String, String> explanations,  // 신호명 -> 설명 문장
        Map<String, Object> signals        // 계산에 쓰인 원시 입력 (URL, 카운트, 날짜 등)
) {
    public static final double NEUTRAL = 0.5;

    public CredibilityScore {
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        explanations = explanations == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(explanations));
        // signals 는 null 값을 허용해야 하므로 Map.copyOf 사용 불가
        signals = signals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(signals));
    }

    public static CredibilityScore neutral() {
        return new CredibilityScore(NEUTRAL, Map.of(), Map.of(), Map.of());
    }
}
