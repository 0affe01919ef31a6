package com.goormthonuniv.factmerge.authority;

import com.goormthonuniv.factmerge.llm.LlmJudge;
import com.goormthonuniv.factmerge.lookup.PopularityIndexAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * URL → 0.0~1.0 출처 권위 점수. 단계별 폴백, 먼저 적중한 단계가 이긴다.
 * <ol>
 *     <li>tier 0 정적 보정 테이블</li>
 *     <li>tier 1 TLD 패턴</li>
 *     <li>등록 도메인 캐시</li>
 *     <li>tier 2 인기도 API (OpenPageRank)</li>
 *     <li>tier 3 LLM 추론</li>
 *     <li>기본값 0.45</li>
 * </ol>
 * tier 2/3/기본값 결과는 캐시에 기록된다. 외부 호출 실패는 miss 로 처리되고 예외를 던지지 않는다.
 * 캐시 저장 실패({@link DomainTrustPersistenceException})만 전파된다.
 * <p>
 * 같은 도메인을 동시에 처음 조회하면 양쪽 모두 tier 2/3 을 실행하고 둘 다 캐시에 쓴다 (마지막 쓰기 우선).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceAuthorityResolver {

    public static final double NO_URL_SCORE = 0.5;
    public static final double DEFAULT_SCORE = 0.45;

    private final DomainTrustPolicy policy;
    private final DomainTrustRepository repository;
    private final PopularityIndexAdapter popularityIndex;
    private final LlmJudge llmJudge;

    public double resolve(String url) {
        return resolveDetailed(url).score();
    }

    public AuthorityResult resolveDetailed(String url) {
        if (url == null || url.isBlank()) {
            return new AuthorityResult(NO_URL_SCORE, null, null, false);
        }

        Optional<Double> t0 = policy.staticScore(url);
        if (t0.isPresent()) return new AuthorityResult(t0.get(), TrustMethod.STATIC, null, false);

        Optional<Double> t1 = policy.patternScore(url);
        if (t1.isPresent()) return new AuthorityResult(t1.get(), TrustMethod.TLD_PATTERN, null, false);

        String domain = policy.registrableDomain(url);
        if (domain.isEmpty()) {
            log.debug("[FactMerge] no host in url={}, using default", url);
            return new AuthorityResult(DEFAULT_SCORE, TrustMethod.DEFAULT, null, false);
        }

        Optional<DomainTrustCacheEntry> cached = repository.findByDomain(domain);
        if (cached.isPresent()) {
            DomainTrustCacheEntry e = cached.get();
            return new AuthorityResult(e.score(), e.method(), domain, true);
        }

        Optional<Double> t2 = popularityIndex.authority(domain);
        if (t2.isPresent()) return store(domain, t2.get(), TrustMethod.OPENPAGERANK);
        log.debug("[FactMerge] tier2 miss domain={}", domain);

        Optional<Double> t3 = llmJudge.rateDomain(domain);
        if (t3.isPresent()) return store(domain, t3.get(), TrustMethod.LLM);
        log.debug("[FactMerge] tier3 miss domain={}", domain);

        return store(domain, DEFAULT_SCORE, TrustMethod.DEFAULT);
    }

    private AuthorityResult store(String domain, double score, TrustMethod method) {
        repository.save(domain, score, method);
        log.info("[FactMerge] domain={} score={} method={}", domain, score, method.tag());
        return new AuthorityResult(score, method, domain, false);
    }
}
