package com.qaradar.core.crawler;

import java.net.URI;
import java.util.Set;

/** 이미 가져온 HTML에서 same-origin canonical URL을 뽑아내는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * @param html    페이지 원본 HTML (null이면 빈 집합)
     * @param baseUrl 상대 경로 해석 기준(fetch의 최종 URL)
     * @return base와 host가 같은 canonical URL 집합(중복 없음, 순서 보장 없음)
     */
    Set<URI> extract(String html, URI baseUrl);
}
