package com.goormthonuniv.factmerge.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 원격 임베딩. 호출이 실패하면 해당 배치 전체를 로컬 term vector 로 계산한다
 * (한 배치 안에서 프로바이더가 섞이면 코사인 비교가 의미 없어진다).
 */
@Slf4j
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    public static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1/embeddings";

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final EmbeddingProvider fallback;

    public OpenAiEmbeddingProvider(RestClient rest, String endpoint, String apiKey, String model,
                                   EmbeddingProvider fallback) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.fallback = fallback;
    }

    @Override
    public String name() {
        return "openai:" + model;
    }

    @Override
    public double[] embed(String text) {
        return embedAll(List.of(text == null ? "" : text)).get(0);
    }

    @Override
    public List<double[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) return List.of();
        try {
            EmbeddingResponse res = rest.post()
                    .uri(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("model", model, "input", texts))
                    .retrieve()
                    .body(EmbeddingResponse.class);
            List<double[]> vectors = toVectors(res, texts.size());
            if (vectors != null) return vectors;
            log.warn("[FactMerge] embedding response malformed, using {}", fallback.name());
        } catch (RestClientException e) {
            log.warn("[FactMerge] embedding call failed, using {}: {}", fallback.name(), e.getMessage());
        }
        return fallback.embedAll(texts);
    }

    /** 입력 개수와 맞지 않거나 빈 벡터가 있으면 null */
    static List<double[]> toVectors(EmbeddingResponse res, int expected) {
        if (res == null || res.data == null || res.data.size() != expected) return null;
        List<EmbeddingItem> items = new ArrayList<>(res.data);
        items.sort(Comparator.comparingInt(i -> i.index));
        List<double[]> out = new ArrayList<>(expected);
        for (EmbeddingItem item : items) {
            if (item.embedding == null || item.embedding.isEmpty()) return null;
            double[] v = new double[item.embedding.size()];
            for (int i = 0; i < v.length; i++) v[i] = item.embedding.get(i);
            out.add(TermVectorEmbeddingProvider.unit(v));
        }
        return out;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EmbeddingResponse {
        public List<EmbeddingItem> data;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EmbeddingItem {
        public int index;
        public List<Double> embedding;
    }
}
