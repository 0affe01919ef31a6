package com.goormthonuniv.factmerge.authority;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DomainTrustCacheEntry(
        String domain,                               // 등록 도메인 (예: bbc.com), 유일 키
        double score,                                // 0.0~1.0
        TrustMethod method,
        @JsonProperty("updated_at") Instant updatedAt
) {}
