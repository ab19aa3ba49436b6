package com.qaradar.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** 신뢰도. 선언 순서 = 강도 순서(LOW &lt; MODERATE &lt; HIGH). */
public enum ConfidenceLevel {
    LOW("Low"),
    MODERATE("Moderate"),
    HIGH("High");

    private final String label;

    ConfidenceLevel(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    public static ConfidenceLevel max(ConfidenceLevel a, ConfidenceLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }
}
