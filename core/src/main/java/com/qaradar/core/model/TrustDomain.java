package com.qaradar.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** 페이지가 속하는 신뢰 도메인. 선언 순서가 브리프의 그룹 순서다. */
public enum TrustDomain {
    BRAND_CREDIBILITY("Brand Credibility"),
    TRANSACTION_SAFETY("Transaction Safety"),
    SUPPORT_RELIABILITY("Support Reliability");

    private final String label;

    TrustDomain(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }
}
