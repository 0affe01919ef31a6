package com.goormthonuniv.factmerge.scoring;

/** Document.metadata 에서 읽고 쓰는 키 */
public final class MetadataKeys {

    private MetadataKeys() {}

    // 입력
    public static final String PUBLISHED_DATE = "published_date";
    public static final String PUBLISHER = "publisher";
    public static final String CORROBORATION_SCORE = "corroboration_score";

    // 채점 중 기록
    public static final String SOURCE_AUTHORITY = "source_authority";
    public static final String SOURCE_TRUST_SCORE = "source_trust_score";
    public static final String CITATIONS = "citations";
    public static final String YEAR = "year";
    public static final String VENUE = "venue";
    public static final String PEER_REVIEWED = "peer_reviewed";

    // signals 전용
    public static final String SCORING_METHOD = "scoring_method";
    public static final String SOURCE_URL = "source_url";
}
