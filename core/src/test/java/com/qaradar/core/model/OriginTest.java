package com.qaradar.core.model;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OriginTest {

    @Test
    void identity_is_host_based() {
        Origin o = Origin.of(URI.create("https://Example.com:443/path"));
        assertThat(o.toString()).isEqualTo("https://example.com");
        assertThat(o.contains(URI.create("http://example.com/x"))).isTrue();
        assertThat(o.contains(URI.create("https://sub.example.com/x"))).isFalse();
        assertThat(o.contains(null)).isFalse();
    }

    @Test
    void non_default_port_is_rendered() {
        assertThat(Origin.of(URI.create("http://localhost:8080")).toString()).isEqualTo("http://localhost:8080");
    }

    @Test
    void missing_host_is_invalid_input() {
        assertThatThrownBy(() -> Origin.of(URI.create("/relative"))).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void fetch_result_body_is_empty_on_error() {
        FetchResult r = FetchResult.builder().url(URI.create("https://e.com")).status(500)
                .body("<html>oops</html>").error("HTTP 500").build();
        assertThat(r.getBody()).isEmpty();
        assertThat(r.isUsable()).isFalse();
        assertThat(r.getFinalUrl()).isEqualTo(r.getUrl());
        assertThat(r.toFetchError().getError()).isEqualTo("HTTP 500");
    }
}
