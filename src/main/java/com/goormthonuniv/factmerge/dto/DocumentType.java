package com.goormthonuniv.factmerge.dto;

import java.util.Locale;

public enum DocumentType {
    RESEARCH_PAPER("research_paper"),
    NEWS_ARTICLE("news_article"),
    BLOG_POST("blog_post"),
    LEGAL_DOCUMENT("legal_document"),
    UNKNOWN("unknown");

    private final String tag;

    DocumentType(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    /** 알 수 없는 태그는 UNKNOWN */
    public static DocumentType fromTag(String tag) {
        if (tag == null || tag.isBlank()) return UNKNOWN;
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (DocumentType type : values()) {
            if (type.tag.equals(t)) return type;
        }
        return UNKNOWN;
    }
}
