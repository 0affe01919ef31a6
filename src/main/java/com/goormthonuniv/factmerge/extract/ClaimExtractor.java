package com.goormthonuniv.factmerge.extract;

import com.goormthonuniv.factmerge.dto.Claim;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;
import com.goormthonuniv.factmerge.llm.LlmJudge;
import com.goormthonuniv.factmerge.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 문서 본문 → 원자적 주장 목록.
 * 생성형 서비스로 먼저 뽑고, 실패하면 앞 N 문장 중 40자 넘는 것만 쓴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClaimExtractor {

    static final int MIN_SENTENCE_LENGTH = 40;

    private static final Pattern SENTENCE = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern LEGAL_CLAUSE = Pattern.compile("(?<=[.;])\\s+");

    private static final Map<DocumentType, Profile> PROFILES = new EnumMap<>(DocumentType.class);
    static {
        PROFILES.put(DocumentType.RESEARCH_PAPER, new Profile(
                "Extract 8-12 key factual claims covering the problem, methodology, results, and conclusions. "
                        + "Each claim must be a single precise sentence. "
                        + "Return JSON: {\"claims\": [\"claim 1\", \"claim 2\", ...]}",
                6000, 10, SENTENCE));
        PROFILES.put(DocumentType.NEWS_ARTICLE, new Profile(
                "Extract 5-8 key factual claims from this news article. "
                        + "Each claim must be a single assertive sentence. "
                        + "Return a JSON object with key \"claims\" containing an array of strings.",
                4000, 8, SENTENCE));
        PROFILES.put(DocumentType.BLOG_POST, new Profile(
                "Extract 4-6 key factual claims. Return JSON: {\"claims\": [...]}",
                3000, 6, SENTENCE));
        PROFILES.put(DocumentType.LEGAL_DOCUMENT, new Profile(
                "Extract 5-8 key legal provisions or findings. Return JSON: {\"claims\": [...]}",
                4000, 8, LEGAL_CLAUSE));
    }

    private final LlmJudge llmJudge;

    public List<Claim> extract(Document doc) {
        String text = doc.getRawText();
        if (TextUtils.isBlank(text)) return List.of();

        Profile profile = profileFor(doc.getType());
        Optional<List<String>> llm = llmJudge.extractClaims(profile.instruction(), TextUtils.head(text, profile.textBudget()));
        if (llm.isPresent() && !llm.get().isEmpty()) {
            List<Claim> claims = new ArrayList<>();
            for (String t : llm.get()) claims.add(new Claim(t, doc.getId()));
            log.debug("[FactMerge] doc={} extracted {} claims via llm", doc.getId(), claims.size());
            return claims;
        }

        List<Claim> claims = fallback(doc.getId(), text, profile);
        log.debug("[FactMerge] doc={} extracted {} claims via sentence split", doc.getId(), claims.size());
        return claims;
    }

    /** 앞 maxSentences 문장 중 MIN_SENTENCE_LENGTH 보다 긴 것만 */
    static List<Claim> fallback(String docId, String text, Profile profile) {
        List<String> sentences = TextUtils.splitSentences(text, profile.boundary());
        List<Claim> out = new ArrayList<>();
        for (String s : sentences.subList(0, Math.min(profile.maxSentences(), sentences.size()))) {
            if (s.length() > MIN_SENTENCE_LENGTH) out.add(new Claim(s, docId));
        }
        return out;
    }

    static Profile profileFor(DocumentType type) {
        Profile p = type == null ? null : PROFILES.get(type);
        return p != null ? p : PROFILES.get(DocumentType.NEWS_ARTICLE);
    }

    record Profile(String instruction, int textBudget, int maxSentences, Pattern boundary) {}
}
