package com.goormthonuniv.factmerge.dto;

import java.util.List;

public record ResolutionResult(
        List<Claim> resolvedClaims,
        List<Conflict> conflicts
) {
    public ResolutionResult {
        resolvedClaims = resolvedClaims == null ? List.of() : List.copyOf(resolvedClaims);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static ResolutionResult empty() {
        return new ResolutionResult(List.of(), List.of());
    }
}
