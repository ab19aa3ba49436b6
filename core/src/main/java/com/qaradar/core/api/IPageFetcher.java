package com.qaradar.core.api;

import com.qaradar.core.model.FetchResult;

import java.net.URI;

/**
 * Fetch 최소 계약: URL 하나에 GET 한 번. 재시도하지 않는다.
 * 네트워크/HTTP 실패는 예외가 아니라 FetchResult.error로 돌려준다.
 */
@FunctionalInterface
public interface IPageFetcher extends AutoCloseable {
    FetchResult fetch(URI url);
    @Override default void close() throws Exception {}
}
