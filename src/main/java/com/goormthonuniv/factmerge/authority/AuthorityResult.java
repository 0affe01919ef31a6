package com.goormthonuniv.factmerge.authority;

public record AuthorityResult(
        double score,        // 0.0~1.0
        TrustMethod method,  // URL 이 없으면 null
        String domain,       // 등록 도메인, tier 0/1 적중 시 null
        boolean cached       // 캐시 적중 여부
) {}
