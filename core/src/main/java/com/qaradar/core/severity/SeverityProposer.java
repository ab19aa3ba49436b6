package com.qaradar.core.severity;

import com.qaradar.core.model.AttentionBand;
import com.qaradar.core.model.ConfidenceLevel;
import com.qaradar.core.model.Signal;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 신호 목록 → (attention band, confidence). 두 단계로 분리되어 있다.
 * <ol>
 *   <li>{@link #rawBand(int, boolean)}: 신호 개수만으로 원시 등급 제안 (CRITICAL은 절대 내지 않음)</li>
 *   <li>{@link #cap(AttentionBand, ConfidenceLevel)}: 전체 confidence의 상한으로 끌어내림</li>
 * </ol>
 * 낮은 confidence 근거로는 높은 경보를 낼 수 없다(LOW → 최대 MEDIUM, MODERATE → 최대 HIGH).
 */
public final class SeverityProposer {

    private static final Map<ConfidenceLevel, AttentionBand> CEILING = new EnumMap<>(ConfidenceLevel.class);
    static {
        CEILING.put(ConfidenceLevel.LOW, AttentionBand.MEDIUM);
        CEILING.put(ConfidenceLevel.MODERATE, AttentionBand.HIGH);
        CEILING.put(ConfidenceLevel.HIGH, AttentionBand.CRITICAL);
    }

    public Proposal propose(List<Signal> signals, boolean strictMode) {
        if (signals == null || signals.isEmpty()) {
            // 증거 없음 자체가 높은 확신의 관찰이다
            return new Proposal(AttentionBand.LOW, ConfidenceLevel.HIGH);
        }
        ConfidenceLevel overall = overallConfidence(signals);
        AttentionBand raw = rawBand(signals.size(), strictMode);
        return new Proposal(cap(raw, overall), overall);
    }

    /** 가장 높은 개별 confidence (낙관적 집계). 비어있으면 HIGH. */
    public static ConfidenceLevel overallConfidence(List<Signal> signals) {
        ConfidenceLevel max = null;
        if (signals != null) {
            for (Signal s : signals) {
                if (s != null) max = ConfidenceLevel.max(max, s.getConfidence());
            }
        }
        return max == null ? ConfidenceLevel.HIGH : max;
    }

    /**
     * 기본 모드: 3개 이상 MEDIUM, 그 외 LOW (HIGH 이상으로 올리지 않는다).
     * strict 모드: 4개 이상 HIGH, 2개 이상 MEDIUM, 그 외 LOW.
     */
    public static AttentionBand rawBand(int signalCount, boolean strictMode) {
        if (strictMode) {
            if (signalCount >= 4) return AttentionBand.HIGH;
            if (signalCount >= 2) return AttentionBand.MEDIUM;
            return AttentionBand.LOW;
        }
        return signalCount >= 3 ? AttentionBand.MEDIUM : AttentionBand.LOW;
    }

    public static AttentionBand ceilingFor(ConfidenceLevel confidence) {
        AttentionBand c = CEILING.get(confidence);
        return c == null ? AttentionBand.MEDIUM : c;
    }

    /** 원시 등급이 상한을 넘으면 상한으로 낮춘다 */
    public static AttentionBand cap(AttentionBand raw, ConfidenceLevel confidence) {
        return AttentionBand.min(raw, ceilingFor(confidence));
    }
}
