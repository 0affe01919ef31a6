package com.goormthonuniv.factmerge.lookup;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

@Slf4j
@Component
public class OpenPageRankAdapter implements PopularityIndexAdapter {

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;

    public OpenPageRankAdapter(RestClient rest,
                               @Value("${factmerge.adapters.openpagerank.endpoint:https://openpagerank.com/api/v1.0/getPageRank}") String endpoint,
                               @Value("${factmerge.adapters.openpagerank.apiKey:}") String apiKey) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override public String name() { return "openpagerank"; }

    @Override
    public Optional<Double> authority(String domain) {
        if (apiKey == null || apiKey.isBlank() || domain == null || domain.isBlank()) return Optional.empty();
        try {
            URI uri = URI.create(endpoint + "?" + URLEncoder.encode("domains[]", StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(domain, StandardCharsets.UTF_8));

            Map<String, Object> res = rest.get().uri(uri)
                    .header("API-OPR", apiKey)
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});

            return rawRank(res).map(OpenPageRankAdapter::normalize);
        } catch (RestClientException e) {
            log.debug("[FactMerge] adapter={} domain={} error={}", name(), domain, e.getMessage());
            return Optional.empty();
        }
    }

    /** {"response":[{"page_rank_decimal": 5.31, ...}]} 에서 원점수 추출 */
    static Optional<Double> rawRank(Map<String, Object> res) {
        if (res == null) return Optional.empty();
        Object raw = res.get("response");
        if (!(raw instanceof List<?> list) || list.isEmpty()) return Optional.empty();
        if (!(list.get(0) instanceof Map<?, ?> first)) return Optional.empty();
        Object pr = first.get("page_rank_decimal");
        if (pr instanceof Number n) return Optional.of(n.doubleValue());
        if (pr instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * 0~10 원점수 → 0.20~0.90 포화 곡선.
     * PR 9 ≈ 0.87, PR 7 ≈ 0.84, PR 5 ≈ 0.78, PR 2 ≈ 0.55
     */
    static double normalize(double raw) {
        double v = 0.20 + 0.70 * (1 - Math.exp(-0.35 * raw));
        return Math.round(v * 10000.0) / 10000.0;
    }
}
