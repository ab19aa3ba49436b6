package com.qaradar.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** 수집 가시성 지표. 위험도와는 무관하다. */
public enum DiscoveryHealth {
    HIGH("High"),
    MEDIUM("Medium"),
    LIMITED("Limited");

    private final String label;

    DiscoveryHealth(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    /** 성공적으로 가져온 페이지 수 기준: 6 이상 HIGH, 2 이상 MEDIUM, 그 외 LIMITED */
    public static DiscoveryHealth fromYield(int fetchedPages) {
        if (fetchedPages >= 6) return HIGH;
        if (fetchedPages >= 2) return MEDIUM;
        return LIMITED;
    }
}
