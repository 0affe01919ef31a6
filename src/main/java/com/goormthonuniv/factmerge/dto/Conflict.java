package com.goormthonuniv.factmerge.dto;

import java.util.List;

public record Conflict(
        List<Claim> claims,      // 2개 이상 문서에서 온 같은 클러스터의 주장들
        String topic,            // 첫 주장 앞 80자 + "…"
        String resolution,       // 채택된 주장 텍스트 (미해결이면 null)
        ConflictStatus status,
        double confidence        // 0.0~1.0
) {
    public Conflict {
        claims = claims == null ? List.of() : List.copyOf(claims);
        topic = topic == null ? "" : topic;
    }

    public static Conflict unresolvedEmpty() {
        return new Conflict(List.of(), "", null, ConflictStatus.UNRESOLVED, 0.0);
    }

    public boolean isResolved() {
        return status == ConflictStatus.RESOLVED;
    }

    public Conflict withTopic(String newTopic) {
        return new Conflict(claims, newTopic, resolution, status, confidence);
    }
}
