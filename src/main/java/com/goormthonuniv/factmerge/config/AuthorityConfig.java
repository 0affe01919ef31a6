package com.goormthonuniv.factmerge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.factmerge.authority.DomainTrustRepository;
import com.goormthonuniv.factmerge.authority.InMemoryDomainTrustRepository;
import com.goormthonuniv.factmerge.authority.JsonFileDomainTrustRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Slf4j
@Configuration
public class AuthorityConfig {

    /** 채점 최신성·캐시 타임스탬프 공용 시계 */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** cache-file 이 비어 있으면 프로세스 메모리에만 보관 */
    @Bean
    public DomainTrustRepository domainTrustRepository(
            ObjectMapper om,
            Clock clock,
            @Value("${factmerge.authority.cache-file:}") String cacheFile) {
        if (cacheFile == null || cacheFile.isBlank()) {
            log.info("[FactMerge] domain trust cache: in-memory");
            return new InMemoryDomainTrustRepository(clock);
        }
        log.info("[FactMerge] domain trust cache: {}", cacheFile);
        return new JsonFileDomainTrustRepository(Path.of(cacheFile), om, clock);
    }
}
