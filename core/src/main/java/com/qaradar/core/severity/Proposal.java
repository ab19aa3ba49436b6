package com.qaradar.core.severity;

import com.qaradar.core.model.AttentionBand;
import com.qaradar.core.model.ConfidenceLevel;

import java.util.Objects;

/** 페이지 단위 제안 결과: (attention band, overall confidence) */
public record Proposal(AttentionBand band, ConfidenceLevel confidence) {
    public Proposal {
        Objects.requireNonNull(band, "band");
        Objects.requireNonNull(confidence, "confidence");
    }
}
