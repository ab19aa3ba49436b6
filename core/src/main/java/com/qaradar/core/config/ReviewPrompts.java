package com.qaradar.core.config;

import com.qaradar.core.model.TrustDomain;

import java.util.EnumMap;
import java.util.Map;

/** 도메인별 시니어 리뷰 프롬프트(고정 문구, 조회만 한다) */
public final class ReviewPrompts {
    private ReviewPrompts() {}

    private static final Map<TrustDomain, String> PROMPTS = new EnumMap<>(TrustDomain.class);
    static {
        PROMPTS.put(TrustDomain.BRAND_CREDIBILITY,
                "Would a first-time visitor believe the claims on this page? "
                        + "Check that maturity labels, superlatives and page structure match what the product actually delivers.");
        PROMPTS.put(TrustDomain.TRANSACTION_SAFETY,
                "Could a user lose money or commit to something they did not intend here? "
                        + "Walk the pricing, billing and checkout path and confirm terms are visible before commitment.");
        PROMPTS.put(TrustDomain.SUPPORT_RELIABILITY,
                "If something goes wrong, can the user get help and understand their rights? "
                        + "Verify that contact routes work and that policy text is current, consistent and reachable.");
    }

    public static String forDomain(TrustDomain domain) {
        String p = PROMPTS.get(domain);
        return p == null ? "" : p;
    }
}
