package com.qaradar.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 단일 GET 시도의 결과. URL당 하나, 재시도 없음.
 * body는 200 + HTML 판정일 때만 비어있지 않다.
 */
public final class FetchResult {
    private final URI url;
    private final URI finalUrl;
    private final int status;        // 응답 자체가 없으면 -1
    private final String body;
    private final String contentType;
    private final String error;      // 사용 가능하면 null
    private final long elapsedMs;

    private FetchResult(Builder b) {
        this.url = b.url;
        this.finalUrl = (b.finalUrl == null ? b.url : b.finalUrl);
        this.status = b.status;
        this.body = (b.error != null || b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.error = b.error;
        this.elapsedMs = b.elapsedMs;
    }

    public URI getUrl() { return url; }
    /** 리다이렉트 이후 최종 URL. 이후의 식별 판단은 항상 이 값을 쓴다. */
    public URI getFinalUrl() { return finalUrl; }
    public int getStatus() { return status; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public String getError() { return error; }
    public long getElapsedMs() { return elapsedMs; }

    public boolean isUsable() {
        return error == null && !body.isEmpty();
    }

    public FetchError toFetchError() {
        return new FetchError(url, status, error == null ? "empty body" : error);
    }

    /** 실패 결과 단축 생성 */
    public static FetchResult failed(URI url, int status, String error) {
        return builder().url(url).status(status).error(error).build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private URI finalUrl;
        private int status = -1;
        private String body;
        private String contentType;
        private String error;
        private long elapsedMs;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder finalUrl(URI finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder status(int status) { this.status = status; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder error(String error) { this.error = error; return this; }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            return new FetchResult(this);
        }
    }
}
