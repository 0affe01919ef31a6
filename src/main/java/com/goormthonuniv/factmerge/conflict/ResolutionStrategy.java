package com.goormthonuniv.factmerge.conflict;

import com.goormthonuniv.factmerge.dto.Claim;
import com.goormthonuniv.factmerge.dto.Conflict;
import com.goormthonuniv.factmerge.dto.ConflictStatus;
import com.goormthonuniv.factmerge.dto.DocumentType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 2개 이상 문서에 걸친 클러스터 하나를 판정하는 전략.
 * credibility 는 문서 id → overall. topic 은 엔진이 채운다.
 */
@Slf4j
public enum ResolutionStrategy {

    /** 가장 신뢰도 높은 문서의 주장. 신뢰도 폭이 0.15 미만이면 미해결 */
    WEIGHTED_VOTE("weighted_vote") {
        @Override
        public Conflict apply(List<Claim> claims, Map<String, Double> credibility) {
            if (claims.isEmpty()) return Conflict.unresolvedEmpty();

            List<Claim> ranked = new ArrayList<>(claims);
            // 안정 정렬: 동점이면 입력 순서 유지
            ranked.sort(Comparator.comparingDouble((Claim c) -> credibilityOf(c, credibility, 0.5)).reversed());

            Claim best = ranked.get(0);
            double top = credibilityOf(best, credibility, 0.5);
            double bottom = credibilityOf(ranked.get(ranked.size() - 1), credibility, 0.5);

            if (top - bottom < WEIGHTED_VOTE_SPREAD) {
                return new Conflict(claims, "", null, ConflictStatus.UNRESOLVED, top);
            }
            return new Conflict(claims, "", best.text(), ConflictStatus.RESOLVED, top);
        }
    },

    /** 고신뢰(≥0.75) 출처가 둘 이상이면 그 중 첫 주장을 0.85 로 채택, 아니면 가중 투표 */
    MAJORITY_VOTE("majority_vote") {
        @Override
        public Conflict apply(List<Claim> claims, Map<String, Double> credibility) {
            List<Claim> highTrust = claims.stream()
                    .filter(c -> credibilityOf(c, credibility, 0.0) >= HIGH_TRUST)
                    .toList();
            if (highTrust.size() >= 2) {
                return new Conflict(claims, "", highTrust.get(0).text(), ConflictStatus.RESOLVED, MAJORITY_CONFIDENCE);
            }
            return WEIGHTED_VOTE.apply(claims, credibility);
        }
    },

    /** 임계값 없이 항상 최고 신뢰도 출처를 채택 */
    HIGHEST_CREDIBILITY_WINS("highest_credibility_wins") {
        @Override
        public Conflict apply(List<Claim> claims, Map<String, Double> credibility) {
            if (claims.isEmpty()) return Conflict.unresolvedEmpty();
            Claim best = claims.get(0);
            for (Claim c : claims) {
                if (credibilityOf(c, credibility, 0.0) > credibilityOf(best, credibility, 0.0)) best = c;
            }
            return new Conflict(claims, "", best.text(), ConflictStatus.RESOLVED,
                    credibilityOf(best, credibility, 0.5));
        }
    },

    /** 모든 불일치를 미해결로 표시 */
    CONSERVATIVE("conservative") {
        @Override
        public Conflict apply(List<Claim> claims, Map<String, Double> credibility) {
            return new Conflict(claims, "", null, ConflictStatus.UNRESOLVED, 0.0);
        }
    };

    public static final double WEIGHTED_VOTE_SPREAD = 0.15;
    public static final double HIGH_TRUST = 0.75;
    public static final double MAJORITY_CONFIDENCE = 0.85;
    public static final String AUTO = "auto";

    private final String tag;

    ResolutionStrategy(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public abstract Conflict apply(List<Claim> claims, Map<String, Double> credibility);

    /** 문서 유형별 기본 전략 */
    public static ResolutionStrategy defaultFor(DocumentType type) {
        if (type == null) return CONSERVATIVE;
        return switch (type) {
            case RESEARCH_PAPER, BLOG_POST -> WEIGHTED_VOTE;
            case NEWS_ARTICLE -> MAJORITY_VOTE;
            case LEGAL_DOCUMENT -> HIGHEST_CREDIBILITY_WINS;
            case UNKNOWN -> CONSERVATIVE;
        };
    }

    /**
     * 이름 → 전략. null/빈값/"auto" 는 유형 기본값, 모르는 이름은 경고 후 가중 투표.
     */
    public static ResolutionStrategy resolve(String name, DocumentType dominantType) {
        if (name == null || name.isBlank() || AUTO.equalsIgnoreCase(name.trim())) {
            return defaultFor(dominantType);
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (ResolutionStrategy s : values()) {
            if (s.tag.equals(n)) return s;
        }
        log.warn("[FactMerge] unknown strategy '{}', falling back to {}", name, WEIGHTED_VOTE.tag);
        return WEIGHTED_VOTE;
    }

    static double credibilityOf(Claim c, Map<String, Double> credibility, double missing) {
        Double v = credibility.get(c.sourceDocId());
        return v == null ? missing : v;
    }
}
