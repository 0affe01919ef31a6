package com.goormthonuniv.factmerge.dto;

import java.util.List;

public record AnalysisReport(
        List<String> docIds,
        List<Claim> resolvedClaims,
        List<Conflict> conflicts,
        List<DocumentType> docTypesPresent,
        String strategy          // 실제 적용된 전략명 (단일 문서면 "none")
) {}
