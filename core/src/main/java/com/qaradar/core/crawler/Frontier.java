package com.qaradar.core.crawler;

import com.qaradar.core.model.InvalidConfigurationException;
import com.qaradar.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 홈페이지 + 추출 링크 → 순서 고정, 중복 제거, 크기 제한된 방문 목록.
 * - 홈페이지는 항상 첫 번째
 * - 나머지는 canonical 문자열 사전순(입력 순서와 무관하게 결정적)
 * - maxPages에서 자른다
 */
public final class Frontier {
    private Frontier() {}

    private static final Comparator<URI> ORDER = Comparator.comparing(URI::toString);

    public static List<URI> bound(URI originUrl, Collection<URI> extractedLinks, int maxPages) {
        Objects.requireNonNull(originUrl, "originUrl");
        if (maxPages < 1) {
            throw new InvalidConfigurationException("maxPages must be a positive integer: " + maxPages);
        }

        URI home = UrlUtils.canonicalize(originUrl);
        if (home == null) home = originUrl;

        Set<URI> seen = new LinkedHashSet<>();
        seen.add(home);

        List<URI> rest = new ArrayList<>();
        if (extractedLinks != null) {
            for (URI raw : extractedLinks) {
                URI c = UrlUtils.canonicalize(raw);
                if (c != null && seen.add(c)) rest.add(c);
            }
        }
        rest.sort(ORDER);

        List<URI> out = new ArrayList<>(Math.min(maxPages, rest.size() + 1));
        out.add(home);
        for (URI u : rest) {
            if (out.size() >= maxPages) break;
            out.add(u);
        }
        return List.copyOf(out);
    }
}
