package com.goormthonuniv.factmerge.authority;

import java.util.Collection;
import java.util.Optional;

/**
 * 도메인 신뢰도 캐시 저장소.
 * 저장 실패는 {@link DomainTrustPersistenceException} 으로 호출자에게 전파된다.
 */
public interface DomainTrustRepository {

    Optional<DomainTrustCacheEntry> findByDomain(String domain);

    /** 없으면 생성, 있으면 score/method/updatedAt 갱신 (last write wins) */
    DomainTrustCacheEntry save(String domain, double score, TrustMethod method);

    Collection<DomainTrustCacheEntry> findAll();
}
