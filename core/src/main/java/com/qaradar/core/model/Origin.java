package com.qaradar.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * (scheme, host) 식별 경계. same-origin 판정은 host 기준이며
 * scheme 불일치만으로는 다른 origin으로 보지 않는다.
 */
public final class Origin {
    private final String scheme;
    private final String host;
    private final int port; // 기본 포트면 -1

    private Origin(String scheme, String host, int port) {
        this.scheme = scheme;
        this.host = host;
        this.port = port;
    }

    public static Origin of(URI uri) {
        Objects.requireNonNull(uri, "uri");
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new InvalidInputException("URL has no host: " + uri);
        }
        String scheme = (uri.getScheme() == null ? "https" : uri.getScheme()).toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) port = -1;
        return new Origin(scheme, uri.getHost().toLowerCase(Locale.ROOT), port);
    }

    public String getScheme() { return scheme; }
    public String getHost() { return host; }
    public int getPort() { return port; }

    /** host가 정확히 같으면 같은 origin 소속 */
    public boolean contains(URI uri) {
        return uri != null && uri.getHost() != null && uri.getHost().equalsIgnoreCase(host);
    }

    public URI toUri() {
        return URI.create(toString());
    }

    @JsonValue
    @Override
    public String toString() {
        return scheme + "://" + host + (port > 0 ? ":" + port : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Origin other)) return false;
        return port == other.port && scheme.equals(other.scheme) && host.equals(other.host);
    }

    @Override
    public int hashCode() { return Objects.hash(scheme, host, port); }
}
