package com.qaradar.core.classify;

import com.qaradar.core.model.TrustDomain;
import com.qaradar.core.util.UrlUtils;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class TrustDomainClassifierTest {

    private final TrustDomainClassifier classifier = new TrustDomainClassifier();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "/checkout,        TRANSACTION_SAFETY",
            "/cart/items,      TRANSACTION_SAFETY",
            "/Pricing,         TRANSACTION_SAFETY",
            "/support,         SUPPORT_RELIABILITY",
            "/legal/privacy,   SUPPORT_RELIABILITY",
            "/help-center,     SUPPORT_RELIABILITY",
            "/about,           BRAND_CREDIBILITY",
            "/blog/post-1,     BRAND_CREDIBILITY"
    })
    void classifies_by_path_keyword(String path, TrustDomain expected) {
        assertThat(classifier.classify(URI.create("https://example.com" + path))).isEqualTo(expected);
    }

    @Test
    void homepage_is_brand_credibility() {
        assertThat(classifier.classify(URI.create("https://example.com"))).isEqualTo(TrustDomain.BRAND_CREDIBILITY);
    }

    @Test
    void support_wins_when_both_keyword_sets_match() {
        assertThat(classifier.classify(URI.create("https://example.com/order-support")))
                .isEqualTo(TrustDomain.SUPPORT_RELIABILITY);
        assertThat(classifier.classify(URI.create("https://example.com/refund/order")))
                .isEqualTo(TrustDomain.SUPPORT_RELIABILITY);
    }

    @Test
    void checkout_link_with_query_and_fragment() {
        URI canonical = UrlUtils.canonicalize(URI.create("https://host.example/checkout?ref=123#top"));
        assertThat(canonical.toString()).isEqualTo("https://host.example/checkout");
        assertThat(classifier.classify(canonical)).isEqualTo(TrustDomain.TRANSACTION_SAFETY);
    }

    @Test
    void query_is_not_considered() {
        assertThat(classifier.classify(URI.create("https://example.com/news?next=checkout")))
                .isEqualTo(TrustDomain.BRAND_CREDIBILITY);
    }
}
