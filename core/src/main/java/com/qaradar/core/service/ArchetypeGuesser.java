package com.qaradar.core.service;

import com.qaradar.core.model.Archetype;
import org.jsoup.Jsoup;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** 홈페이지 보이는 텍스트로 사이트 유형을 추정. 참고용이며 점수 계산에 쓰지 않는다. */
public final class ArchetypeGuesser {

    // 삽입 순서 = 평가 우선순위
    private static final Map<Archetype, List<String>> BUCKETS = new LinkedHashMap<>();
    static {
        BUCKETS.put(Archetype.REGULATED_MEDICAL, List.of(
                "patient", "clinic", "medical", "healthcare", "pharmacy", "hipaa", "insurance", "prescription"));
        BUCKETS.put(Archetype.COMMERCIAL_TRANSACTIONAL, List.of(
                "add to cart", "checkout", "shop", "buy now", "pricing", "free shipping"));
        BUCKETS.put(Archetype.B2B_ENTERPRISE, List.of(
                "enterprise", "b2b", "saas", "platform", "request a demo", "integrations", "api"));
    }

    public Archetype guess(String homepageHtml) {
        if (homepageHtml == null || homepageHtml.isBlank()) return Archetype.GENERAL;
        String text = " " + Jsoup.parse(homepageHtml).text().toLowerCase(Locale.ROOT) + " ";
        for (var e : BUCKETS.entrySet()) {
            for (String kw : e.getValue()) {
                if (containsWord(text, kw)) return e.getKey();
            }
        }
        return Archetype.GENERAL;
    }

    /** 단어 경계 기준 포함 여부("api"가 "capital"에 걸리지 않도록) */
    private static boolean containsWord(String text, String kw) {
        int from = 0;
        while (true) {
            int i = text.indexOf(kw, from);
            if (i < 0) return false;
            int end = i + kw.length();
            boolean left = i == 0 || !Character.isLetterOrDigit(text.charAt(i - 1));
            boolean right = end >= text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (left && right) return true;
            from = i + 1;
        }
    }
}
