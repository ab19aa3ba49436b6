package com.qaradar.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 지시적(indicative) 주의 등급. 최종 결함 심각도가 아니다.
 * 선언 순서 = 높낮이 순서. CRITICAL은 사람의 명시적 상향 조정용으로 예약.
 */
public enum AttentionBand {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    AttentionBand(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    public static AttentionBand min(AttentionBand a, AttentionBand b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
