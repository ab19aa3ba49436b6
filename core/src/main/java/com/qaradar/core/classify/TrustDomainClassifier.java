package com.qaradar.core.classify;

import com.qaradar.core.model.TrustDomain;
import com.qaradar.core.util.UrlUtils;

import java.net.URI;
import java.util.List;

/**
 * URL 경로 → 신뢰 도메인. 순수 함수(네트워크/가변 상태 없음).
 * 경로가 두 키워드 집합에 모두 걸리면 SUPPORT_RELIABILITY가 이긴다.
 */
public final class TrustDomainClassifier {

    static final List<String> SUPPORT_TERMS = List.of(
            "support", "help", "contact", "faq", "legal", "privacy",
            "terms", "policy", "refund", "returns", "accessibility");

    static final List<String> TRANSACTION_TERMS = List.of(
            "checkout", "cart", "billing", "pricing", "payment",
            "subscribe", "plans", "order", "purchase");

    public TrustDomain classify(URI url) {
        String path = UrlUtils.pathOf(url);
        if (containsAny(path, SUPPORT_TERMS)) return TrustDomain.SUPPORT_RELIABILITY;
        if (containsAny(path, TRANSACTION_TERMS)) return TrustDomain.TRANSACTION_SAFETY;
        return TrustDomain.BRAND_CREDIBILITY;
    }

    private static boolean containsAny(String path, List<String> terms) {
        for (String t : terms) {
            if (path.contains(t)) return true;
        }
        return false;
    }
}
