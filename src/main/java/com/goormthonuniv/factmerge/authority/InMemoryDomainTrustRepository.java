package com.goormthonuniv.factmerge.authority;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public class InMemoryDomainTrustRepository implements DomainTrustRepository {

    private static final long MAX_DOMAINS = 50_000;

    private final Cache<String, DomainTrustCacheEntry> entries = Caffeine.newBuilder()
            .maximumSize(MAX_DOMAINS)
            .build();

    private final Clock clock;

    public InMemoryDomainTrustRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryDomainTrustRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<DomainTrustCacheEntry> findByDomain(String domain) {
        if (domain == null) return Optional.empty();
        return Optional.ofNullable(entries.getIfPresent(domain));
    }

    @Override
    public DomainTrustCacheEntry save(String domain, double score, TrustMethod method) {
        DomainTrustCacheEntry entry = new DomainTrustCacheEntry(domain, score, method, Instant.now(clock));
        entries.put(domain, entry);
        return entry;
    }

    @Override
    public Collection<DomainTrustCacheEntry> findAll() {
        return List.copyOf(entries.asMap().values());
    }

    /** previous 가 null 이면 항목 제거 */
    protected void restore(String domain, DomainTrustCacheEntry previous) {
        if (previous == null) entries.invalidate(domain);
        else entries.put(domain, previous);
    }

    protected void load(Collection<DomainTrustCacheEntry> loaded) {
        for (DomainTrustCacheEntry e : loaded) {
            if (e != null && e.domain() != null) entries.put(e.domain(), e);
        }
    }
}
