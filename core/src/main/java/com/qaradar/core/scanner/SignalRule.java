package com.qaradar.core.scanner;

import com.qaradar.core.model.ConfidenceLevel;
import com.qaradar.core.model.EvidenceType;
import com.qaradar.core.model.Signal;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 규칙 테이블의 한 행: (matcher, description, evidenceType, confidence).
 * 페이지당 최대 한 개의 Signal을 만든다. confidence는 규칙에 고정.
 */
public final class SignalRule {
    private final String id;
    private final Predicate<String> matcher;
    private final String description;
    private final EvidenceType evidenceType;
    private final String rationale;
    private final ConfidenceLevel confidence;

    public SignalRule(String id, Predicate<String> matcher, String description,
                      EvidenceType evidenceType, String rationale, ConfidenceLevel confidence) {
        this.id = Objects.requireNonNull(id, "id");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.description = Objects.requireNonNull(description, "description");
        this.evidenceType = Objects.requireNonNull(evidenceType, "evidenceType");
        this.rationale = Objects.requireNonNull(rationale, "rationale");
        this.confidence = Objects.requireNonNull(confidence, "confidence");
    }

    /** 정규식 한 번이라도 매치되면 발화 */
    public static SignalRule ofPattern(String id, Pattern pattern, String description,
                                       EvidenceType evidenceType, String rationale, ConfidenceLevel confidence) {
        Objects.requireNonNull(pattern, "pattern");
        return new SignalRule(id, html -> pattern.matcher(html).find(),
                description, evidenceType, rationale, confidence);
    }

    /** 정규식이 minCount번 이상 매치되면 발화 */
    public static SignalRule ofCount(String id, Pattern pattern, int minCount, String description,
                                     EvidenceType evidenceType, String rationale, ConfidenceLevel confidence) {
        Objects.requireNonNull(pattern, "pattern");
        return new SignalRule(id, html -> {
            var m = pattern.matcher(html);
            int n = 0;
            while (m.find()) {
                if (++n >= minCount) return true;
            }
            return false;
        }, description, evidenceType, rationale, confidence);
    }

    public Optional<Signal> evaluate(String html) {
        if (!matcher.test(html)) return Optional.empty();
        return Optional.of(new Signal(id, description, evidenceType, rationale, confidence));
    }

    public String getId() { return id; }
    public ConfidenceLevel getConfidence() { return confidence; }
    public EvidenceType getEvidenceType() { return evidenceType; }
}
