package com.goormthonuniv.factmerge.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 오케스트레이터가 소유하는 입력 문서.
 * 스코어러는 credibilityScore 와 metadata 를, 추출기는 claims 를 채운다.
 */
@Getter
@Setter
@NoArgsConstructor
public class Document {

    private String id = UUID.randomUUID().toString();

    private DocumentType type = DocumentType.UNKNOWN;

    private String title;

    private String sourceUrl;

    private String rawText = "";

    // published_date, publisher, corroboration_score ... (값 타입은 제각각)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private CredibilityScore credibilityScore;

    private List<Claim> claims = new ArrayList<>();

    @Builder
    public Document(String id, DocumentType type, String title, String sourceUrl, String rawText,
                    Map<String, Object> metadata, CredibilityScore credibilityScore, List<Claim> claims) {
        this.id = id == null ? UUID.randomUUID().toString() : id;
        this.type = type == null ? DocumentType.UNKNOWN : type;
        this.title = title;
        this.sourceUrl = sourceUrl;
        this.rawText = rawText == null ? "" : rawText;
        this.credibilityScore = credibilityScore;
        setMetadata(metadata);
        setClaims(claims);
    }

    /** 채점 중 값을 덧붙이므로 항상 수정 가능한 사본을 보관 (Map.of 로 넘겨도 안전) */
    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    }

    public void setClaims(List<Claim> claims) {
        this.claims = claims == null ? new ArrayList<>() : new ArrayList<>(claims);
    }
}
