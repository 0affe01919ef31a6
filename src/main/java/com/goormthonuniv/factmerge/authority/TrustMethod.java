package com.goormthonuniv.factmerge.authority;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 점수의 출처(provenance) */
public enum TrustMethod {
    STATIC("static"),
    TLD_PATTERN("tld_pattern"),
    OPENPAGERANK("openpagerank"),
    LLM("llm"),
    DEFAULT("default");

    private final String tag;

    TrustMethod(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() { return tag; }

    @JsonCreator
    public static TrustMethod fromTag(String tag) {
        String t = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
        for (TrustMethod m : values()) {
            if (m.tag.equals(t)) return m;
        }
        return DEFAULT;
    }
}
