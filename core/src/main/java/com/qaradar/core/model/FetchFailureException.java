package com.qaradar.core.model;

import java.util.Objects;

/**
 * 홈페이지 fetch 실패. 실행 전체를 중단시키는 유일한 fetch 실패다.
 * 나머지 페이지 실패는 fetch_errors에 기록만 된다.
 */
public class FetchFailureException extends DiscoveryException {
    private final transient FetchResult result;

    public FetchFailureException(FetchResult result) {
        super("Homepage fetch failed: " + Objects.requireNonNull(result, "result").getUrl()
                + " (" + result.getError() + ")");
        this.result = result;
    }

    public FetchResult getResult() { return result; }
}
