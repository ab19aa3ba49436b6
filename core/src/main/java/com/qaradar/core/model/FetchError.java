package com.qaradar.core.model;

import java.net.URI;
import java.util.Objects;

/** 브리프의 fetch_errors 항목 */
public final class FetchError {
    private final URI url;
    private final int status;
    private final String error;

    public FetchError(URI url, int status, String error) {
        this.url = Objects.requireNonNull(url, "url");
        this.status = status;
        this.error = Objects.requireNonNull(error, "error");
    }

    public URI getUrl() { return url; }
    public int getStatus() { return status; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return url + " [" + status + "] " + error;
    }
}
