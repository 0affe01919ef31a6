package com.goormthonuniv.factmerge.dto;

import java.util.Objects;
import java.util.UUID;

public record Claim(
        String id,
        String text,           // 원자적 사실 주장 한 문장
        String sourceDocId,    // 출처 문서 (정확히 하나)
        double confidence      // 0.0~1.0, 기본 1.0
) {
    public static final double DEFAULT_CONFIDENCE = 1.0;

    public Claim {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sourceDocId, "sourceDocId");
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
    }

    public Claim(String text, String sourceDocId) {
        this(null, text, sourceDocId, DEFAULT_CONFIDENCE);
    }

    public Claim(String text, String sourceDocId, double confidence) {
        this(null, text, sourceDocId, confidence);
    }
}
