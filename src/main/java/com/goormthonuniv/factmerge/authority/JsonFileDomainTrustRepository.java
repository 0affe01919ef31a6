package com.goormthonuniv.factmerge.authority;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 재시작 후에도 유지되는 파일 기반 캐시. 저장할 때마다 전체 스냅샷을 다시 쓴다.
 */
@Slf4j
public class JsonFileDomainTrustRepository extends InMemoryDomainTrustRepository {

    private final Path file;
    private final ObjectMapper om;

    public JsonFileDomainTrustRepository(Path file, ObjectMapper om) {
        this(file, om, Clock.systemUTC());
    }

    public JsonFileDomainTrustRepository(Path file, ObjectMapper om, Clock clock) {
        super(clock);
        this.file = file;
        this.om = om;
        if (Files.exists(file)) {
            try {
                List<DomainTrustCacheEntry> loaded = om.readValue(file.toFile(), new TypeReference<List<DomainTrustCacheEntry>>() {});
                load(loaded);
                log.info("[FactMerge] loaded {} cached domain scores from {}", loaded.size(), file);
            } catch (IOException e) {
                throw new DomainTrustPersistenceException("cannot read domain trust cache " + file, e);
            }
        }
    }

    @Override
    public synchronized DomainTrustCacheEntry save(String domain, double score, TrustMethod method) {
        Optional<DomainTrustCacheEntry> previous = findByDomain(domain);
        DomainTrustCacheEntry entry = super.save(domain, score, method);
        try {
            flush();
        } catch (DomainTrustPersistenceException e) {
            // 파일에 못 쓴 항목은 메모리에도 남기지 않는다 (다음 조회 때 재시도)
            restore(domain, previous.orElse(null));
            throw e;
        }
        return entry;
    }

    private synchronized void flush() {
        List<DomainTrustCacheEntry> snapshot = new ArrayList<>(findAll());
        snapshot.sort(Comparator.comparing(DomainTrustCacheEntry::domain));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new DomainTrustPersistenceException("cannot write domain trust cache " + file, e);
        }
    }
}
