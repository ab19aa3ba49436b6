package com.qaradar.core.model;

import java.util.Objects;

/**
 * 근거가 붙은 단일 지표(불변).
 * confidence는 규칙의 고정 속성이며 페이지에 따라 달라지지 않는다.
 */
public final class Signal {
    private final String ruleId;
    private final String description;
    private final EvidenceType evidenceType;
    private final String rationale;
    private final ConfidenceLevel confidence;

    public Signal(String ruleId, String description, EvidenceType evidenceType,
                  String rationale, ConfidenceLevel confidence) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId");
        this.description = Objects.requireNonNull(description, "description");
        this.evidenceType = Objects.requireNonNull(evidenceType, "evidenceType");
        this.rationale = Objects.requireNonNull(rationale, "rationale");
        this.confidence = Objects.requireNonNull(confidence, "confidence");
    }

    public String getRuleId() { return ruleId; }
    public String getDescription() { return description; }
    public EvidenceType getEvidenceType() { return evidenceType; }
    public String getRationale() { return rationale; }
    public ConfidenceLevel getConfidence() { return confidence; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signal s)) return false;
        return ruleId.equals(s.ruleId)
                && description.equals(s.description)
                && evidenceType == s.evidenceType
                && rationale.equals(s.rationale)
                && confidence == s.confidence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, description, evidenceType, rationale, confidence);
    }

    @Override
    public String toString() {
        return ruleId + "(" + confidence.label() + ")";
    }
}
