package com.qaradar.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** 신호가 어떤 근거로 뒷받침되는지 */
public enum EvidenceType {
    DIRECT_OBSERVATION("Direct Observation"),
    PATTERN_CONSISTENCY("Pattern Consistency"),
    CLEAR_USER_IMPACT_PATH("Clear User Impact Path"),
    GROUNDED_PROFESSIONAL_INFERENCE("Grounded Professional Inference");

    private final String label;

    EvidenceType(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }
}
