package com.goormthonuniv.factmerge.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class OpenAiJudge implements LlmJudge {

    private static final String CHAT_URL = "https://api.openai.com/v1/chat/completions";

    private final RestClient rest;
    private final ObjectMapper om;
    private final String apiKey;
    private final String model;
    private final String provider;

    public OpenAiJudge(RestClient rest,
                       ObjectMapper om,
                       @Value("${factmerge.ai.openai.apiKey:}") String apiKey,
                       @Value("${factmerge.ai.openai.model:gpt-4o-mini}") String model,
                       @Value("${factmerge.ai.provider:none}") String provider) {
        this.rest = rest;
        this.om = om;
        this.apiKey = apiKey;
        this.model = model;
        this.provider = provider;
    }

    public boolean isEnabled() {
        return "openai".equalsIgnoreCase(provider) && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Optional<Double> rateDomain(String domain) {
        if (domain == null || domain.isBlank()) return Optional.empty();
        return chatJson(Prompt.DOMAIN_SYSTEM, "Domain: " + domain, 120)
                .flatMap(content -> parseScore(om, content));
    }

    @Override
    public Optional<Double> rateAuthorCredentials(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String excerpt = text.length() > 2000 ? text.substring(0, 2000) : text;
        return chatJson(Prompt.AUTHOR_SYSTEM, excerpt, 60)
                .flatMap(content -> parseScore(om, content));
    }

    @Override
    public Optional<List<String>> extractClaims(String instruction, String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        return chatJson(instruction, text, 800)
                .flatMap(content -> parseClaims(om, content));
    }

    private Optional<String> chatJson(String system, String user, int maxTokens) {
        if (!isEnabled()) return Optional.empty();
        try {
            Map<String, Object> body = Map.of(
                    "model", model,
                    "messages", List.of(
                            Map.of("role", "system", "content", system),
                            Map.of("role", "user", "content", user)
                    ),
                    "temperature", 0,
                    "max_tokens", maxTokens,
                    "response_format", Map.of("type", "json_object")
            );

            ChatResponse res = rest.post()
                    .uri(CHAT_URL)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(ChatResponse.class);

            if (res == null || res.choices == null || res.choices.isEmpty()) return Optional.empty();
            ChatMessage msg = res.choices.get(0).message;
            if (msg == null || msg.content == null || msg.content.isBlank()) return Optional.empty();
            return Optional.of(msg.content);
        } catch (RestClientException e) {
            log.warn("[FactMerge] OpenAI call failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** {"score": 0.0~1.0, ...} 형태만 인정 */
    static Optional<Double> parseScore(ObjectMapper om, String content) {
        try {
            JsonNode score = om.readTree(content).path("score");
            if (!score.isNumber()) return Optional.empty();
            double v = score.asDouble();
            if (v < 0.0 || v > 1.0) return Optional.empty();
            return Optional.of(Math.round(v * 10000.0) / 10000.0);
        } catch (JsonProcessingException e) {
            log.debug("[FactMerge] unparsable score payload: {}", content);
            return Optional.empty();
        }
    }

    /** {"claims": ["...", ...]} 형태. 문자열 아닌 항목은 버린다 */
    static Optional<List<String>> parseClaims(ObjectMapper om, String content) {
        try {
            JsonNode claims = om.readTree(content).path("claims");
            if (!claims.isArray()) return Optional.empty();
            List<String> out = new ArrayList<>();
            for (JsonNode n : claims) {
                if (n.isTextual() && !n.asText().isBlank()) out.add(n.asText().strip());
            }
            return Optional.of(out);
        } catch (JsonProcessingException e) {
            log.debug("[FactMerge] unparsable claims payload: {}", content);
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatResponse {
        public List<ChatChoice> choices;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatChoice {
        public ChatMessage message;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatMessage {
        public String role;
        public String content;
    }

    static class Prompt {
        static final String DOMAIN_SYSTEM = """
        You are a source credibility assessor. Given a domain name, output a JSON object with:
        - "score": float 0.0-1.0 (credibility/authority)
        - "type": one of "news", "academic", "government", "international_org", "advocacy", "blog", "unknown"
        - "reasoning": one short sentence

        Scoring guide:
        - International orgs (UN, WHO, IEA): 0.90-0.97
        - Government agencies: 0.88-0.96
        - Top academic journals/universities: 0.85-0.97
        - Major wire services / public broadcasters: 0.88-0.94
        - Quality news outlets: 0.75-0.88
        - Smaller news / magazines: 0.60-0.75
        - Advocacy / think tanks with known bias: 0.40-0.65
        - Blogs / personal sites: 0.30-0.55
        - Conspiracy / state propaganda: 0.05-0.30

        Respond ONLY with the JSON object.
        """;

        static final String AUTHOR_SYSTEM = """
        Based on any author bio, introduction, or writing style in the text, rate the author's
        apparent expertise and credentials on a scale of 0.0 to 1.0.
        Return ONLY a JSON object: {"score": <float>}
        """;
    }
}
