package com.goormthonuniv.factmerge.config;

import com.goormthonuniv.factmerge.embedding.EmbeddingProvider;
import com.goormthonuniv.factmerge.embedding.OpenAiEmbeddingProvider;
import com.goormthonuniv.factmerge.embedding.TermVectorEmbeddingProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Slf4j
@Configuration
public class EmbeddingConfig {

    /** provider=openai 이고 키가 있으면 원격, 그 외는 로컬 term vector */
    @Bean
    public EmbeddingProvider embeddingProvider(
            RestClient restClient,
            @Value("${factmerge.embedding.provider:local}") String provider,
            @Value("${factmerge.embedding.endpoint:" + OpenAiEmbeddingProvider.DEFAULT_ENDPOINT + "}") String endpoint,
            @Value("${factmerge.embedding.model:text-embedding-3-small}") String model,
            @Value("${factmerge.embedding.dimension:512}") int dimension,
            @Value("${factmerge.ai.openai.apiKey:}") String apiKey) {
        TermVectorEmbeddingProvider local = new TermVectorEmbeddingProvider(dimension);
        if ("openai".equalsIgnoreCase(provider)) {
            if (apiKey == null || apiKey.isBlank()) {
                log.warn("[FactMerge] embedding provider=openai but no api key; using {}", local.name());
                return local;
            }
            return new OpenAiEmbeddingProvider(restClient, endpoint, apiKey, model, local);
        }
        return local;
    }
}
