package com.qaradar.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** 홈페이지 텍스트 기반 사이트 유형 추정(참고용, 점수에 영향 없음) */
public enum Archetype {
    REGULATED_MEDICAL("Regulated / Medical"),
    COMMERCIAL_TRANSACTIONAL("Commercial / Transactional"),
    B2B_ENTERPRISE("B2B / Enterprise"),
    GENERAL("General");

    private final String label;

    Archetype(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }
}
