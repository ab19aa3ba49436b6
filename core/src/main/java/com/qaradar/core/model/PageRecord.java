package com.qaradar.core.model;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/** 성공적으로 가져온 페이지 하나에 대한 분류/신호/제안 결과. 생성 후 변경 불가. */
public final class PageRecord {
    private final URI url;
    private final TrustDomain trustDomain;
    private final List<Signal> signals;
    private final AttentionBand attentionBand;
    private final ConfidenceLevel confidence;
    private final String reviewPrompt;

    public PageRecord(URI url, TrustDomain trustDomain, List<Signal> signals,
                      AttentionBand attentionBand, ConfidenceLevel confidence, String reviewPrompt) {
        this.url = Objects.requireNonNull(url, "url");
        this.trustDomain = Objects.requireNonNull(trustDomain, "trustDomain");
        this.signals = List.copyOf(signals == null ? List.of() : signals);
        this.attentionBand = Objects.requireNonNull(attentionBand, "attentionBand");
        this.confidence = Objects.requireNonNull(confidence, "confidence");
        this.reviewPrompt = (reviewPrompt == null ? "" : reviewPrompt);
    }

    public URI getUrl() { return url; }
    public TrustDomain getTrustDomain() { return trustDomain; }
    public List<Signal> getSignals() { return signals; }
    public AttentionBand getAttentionBand() { return attentionBand; }
    public ConfidenceLevel getConfidence() { return confidence; }
    public String getReviewPrompt() { return reviewPrompt; }
}
