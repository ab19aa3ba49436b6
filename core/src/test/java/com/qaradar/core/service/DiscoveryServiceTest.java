package com.qaradar.core.service;

import com.qaradar.core.api.IPageFetcher;
import com.qaradar.core.model.*;
import com.qaradar.core.scanner.SignalRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscoveryServiceTest {

    private static final URI HOME = URI.create("https://example.com");

    private static URI u(String path) {
        return URI.create("https://example.com" + path);
    }

    private static String page(String body, String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body>").append(body);
        for (String h : hrefs) sb.append("<a href='").append(h).append("'>l</a>");
        return sb.append("</body></html>").toString();
    }

    private static FetchResult ok(URI url, String html) {
        return FetchResult.builder().url(url).status(200).contentType("text/html").body(html).build();
    }

    private static DiscoveryConfig cfg() {
        return DiscoveryConfig.defaults().setTarget("example.com").setRps(1000);
    }

    /** URL → 결과 고정 맵. 없는 URL은 404 */
    static final class MapFetcher implements IPageFetcher {
        final Map<URI, FetchResult> byUrl = new ConcurrentHashMap<>();
        final List<URI> requested = Collections.synchronizedList(new ArrayList<>());

        MapFetcher put(FetchResult r) { byUrl.put(r.getUrl(), r); return this; }

        @Override public FetchResult fetch(URI url) {
            requested.add(url);
            FetchResult r = byUrl.get(url);
            return r != null ? r : FetchResult.failed(url, 404, "HTTP 404");
        }
    }

    @Test
    @DisplayName("홈페이지 실패 → FetchFailureException, 부분 브리프 없음")
    void homepage_failure_aborts_run() {
        IPageFetcher timeout = url -> FetchResult.failed(url, -1, "Timeout after 10000ms");
        DiscoveryService svc = new DiscoveryService(cfg(), timeout);

        assertThatThrownBy(svc::run)
                .isInstanceOf(FetchFailureException.class)
                .hasMessageContaining("Timeout")
                .satisfies(e -> assertThat(((FetchFailureException) e).getResult().getUrl()).isEqualTo(HOME));
    }

    @Test
    void invalid_target_is_rejected_before_any_fetch() {
        MapFetcher f = new MapFetcher();
        DiscoveryService svc = new DiscoveryService(cfg().setTarget("ftp://example.com"), f);
        assertThatThrownBy(svc::run).isInstanceOf(InvalidInputException.class);
        assertThat(f.requested).isEmpty();
    }

    @Test
    void invalid_config_is_rejected_at_construction() {
        assertThatThrownBy(() -> new DiscoveryService(cfg().setMaxPages(0), new MapFetcher()))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new DiscoveryService(cfg().setTarget("  "), new MapFetcher()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new DiscoveryService(cfg().setExcludePaths(List.of("re:(oops")), new MapFetcher()))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("일부 실패는 기록만 하고 나머지 페이지로 브리프를 만든다")
    void partial_failures_are_recorded() {
        MapFetcher f = new MapFetcher()
                .put(ok(HOME, page("<h1>A</h1><h1>B</h1> beta", "/about", "/help", "/checkout")))
                .put(ok(u("/about"), page("About us")))
                .put(ok(u("/checkout"), page("Pay here")));
        // /help → 404

        DiscoveryBrief brief = new DiscoveryService(cfg(), f).run();

        assertThat(brief.getOrigin().toString()).isEqualTo("https://example.com");
        assertThat(brief.getPages()).extracting(p -> p.getUrl().toString()).containsExactly(
                "https://example.com",
                "https://example.com/about",
                "https://example.com/checkout");
        assertThat(brief.getFetchErrors()).singleElement().satisfies(e -> {
            assertThat(e.getUrl()).isEqualTo(u("/help"));
            assertThat(e.getStatus()).isEqualTo(404);
            assertThat(e.getError()).isEqualTo("HTTP 404");
        });
        assertThat(brief.getDiscoveryHealth()).isEqualTo(DiscoveryHealth.MEDIUM);

        PageRecord home = brief.getPages().get(0);
        assertThat(home.getSignals()).extracting(Signal::getRuleId)
                .containsExactly(SignalRules.BETA_LANGUAGE, SignalRules.MULTIPLE_H1);
        assertThat(home.getAttentionBand()).isEqualTo(AttentionBand.LOW);
        assertThat(home.getConfidence()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(home.getReviewPrompt()).isNotBlank();
    }

    @Test
    void only_homepage_gives_limited_health() {
        MapFetcher f = new MapFetcher().put(ok(HOME, page("nothing linked")));
        DiscoveryBrief brief = new DiscoveryService(cfg(), f).run();

        assertThat(brief.getPages()).hasSize(1);
        assertThat(brief.getDiscoveryHealth()).isEqualTo(DiscoveryHealth.LIMITED);
        assertThat(f.requested).containsExactly(HOME);
    }

    @Test
    void frontier_is_bounded_by_max_pages() {
        MapFetcher f = new MapFetcher().put(ok(HOME, page("", "/e", "/d", "/c", "/b", "/a")));
        for (String p : List.of("/a", "/b", "/c", "/d", "/e")) f.put(ok(u(p), page(p)));

        DiscoveryBrief brief = new DiscoveryService(cfg().setMaxPages(3), f).run();

        assertThat(brief.getPages()).extracting(p -> p.getUrl().toString())
                .containsExactly("https://example.com", "https://example.com/a", "https://example.com/b");
        assertThat(f.requested).hasSize(3);
    }

    @Test
    void static_assets_and_excluded_paths_are_not_fetched() {
        MapFetcher f = new MapFetcher()
                .put(ok(HOME, page("", "/logo.png", "/styles/site.css", "/account/login", "/about")))
                .put(ok(u("/about"), page("about")));

        DiscoveryConfig c = cfg().setExcludePaths(List.of("/account"));
        new DiscoveryService(c, f).run();

        assertThat(f.requested).containsExactlyInAnyOrder(HOME, u("/about"));
    }

    @Nested
    @DisplayName("리다이렉트")
    class Redirects {
        @Test
        void off_origin_redirect_becomes_fetch_error() {
            MapFetcher f = new MapFetcher()
                    .put(ok(HOME, page("", "/go")))
                    .put(FetchResult.builder().url(u("/go")).finalUrl(URI.create("https://other.org/landing"))
                            .status(200).contentType("text/html").body(page("elsewhere")).build());

            DiscoveryBrief brief = new DiscoveryService(cfg(), f).run();

            assertThat(brief.getPages()).hasSize(1);
            assertThat(brief.getFetchErrors()).singleElement()
                    .satisfies(e -> assertThat(e.getError()).startsWith("Redirected off-origin"));
        }

        @Test
        void redirect_to_already_analysed_page_is_skipped() {
            MapFetcher f = new MapFetcher()
                    .put(ok(HOME, page("", "/about", "/old-about")))
                    .put(ok(u("/about"), page("about")))
                    .put(FetchResult.builder().url(u("/old-about")).finalUrl(u("/about/"))
                            .status(200).contentType("text/html").body(page("about")).build());

            DiscoveryBrief brief = new DiscoveryService(cfg(), f).run();

            assertThat(brief.getPages()).extracting(p -> p.getUrl().toString())
                    .containsExactly("https://example.com", "https://example.com/about");
            assertThat(brief.getFetchErrors()).isEmpty();
        }

        @Test
        void homepage_redirect_sets_origin_from_final_url() {
            MapFetcher f = new MapFetcher().put(FetchResult.builder().url(HOME)
                    .finalUrl(URI.create("https://www.example.com/"))
                    .status(200).contentType("text/html").body(page("hi")).build());

            DiscoveryBrief brief = new DiscoveryService(cfg(), f).run();
            assertThat(brief.getOrigin().getHost()).isEqualTo("www.example.com");
        }
    }

    @Test
    @DisplayName("완료 순서가 달라도 결과 순서는 같다")
    void output_is_deterministic_despite_completion_order() {
        List<String> paths = List.of("/a", "/b", "/c", "/d", "/e", "/f");
        IPageFetcher jittery = url -> {
            if (url.equals(HOME)) return ok(HOME, page("", paths.toArray(new String[0])));
            // 앞쪽 경로일수록 늦게 끝난다
            int idx = paths.indexOf(url.getPath());
            try { Thread.sleep(20L * (paths.size() - idx)); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
            return ok(url, page(url.getPath()));
        };

        List<URI> first = new DiscoveryService(cfg().setConcurrency(6), jittery).run()
                .getPages().stream().map(PageRecord::getUrl).toList();
        List<URI> second = new DiscoveryService(cfg().setConcurrency(2), jittery).run()
                .getPages().stream().map(PageRecord::getUrl).toList();

        assertThat(first).hasSize(7).isEqualTo(second);
        assertThat(first.subList(1, 7)).isSorted();
    }

    @Test
    void observed_concurrency_never_exceeds_configured_limit() {
        final int CC = 3;
        String[] links = new String[20];
        for (int i = 0; i < links.length; i++) links[i] = "/p" + i;

        IPageFetcher slow = url -> {
            if (url.equals(HOME)) return ok(HOME, page("", links));
            try { Thread.sleep(50); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
            return ok(url, page("x"));
        };

        DiscoveryService svc = new DiscoveryService(cfg().setConcurrency(CC).setMaxPages(21), slow);
        DiscoveryBrief brief = svc.run();

        RunStats.Snapshot rt = svc.getRuntimeSnapshot();
        assertThat(rt.maxObservedConcurrency).isBetween(1, CC);
        assertThat(rt.requestsTotal).isEqualTo(21);
        assertThat(brief.getPages()).hasSize(21);
        assertThat(brief.getDiscoveryHealth()).isEqualTo(DiscoveryHealth.HIGH);
    }

    @Nested
    @DisplayName("데드라인 / 취소")
    class DeadlineAndCancel {
        @Test
        void deadline_returns_partial_brief_with_cancelled_errors() {
            IPageFetcher hanging = url -> {
                if (url.equals(HOME)) return ok(HOME, page("", "/slow1", "/slow2"));
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return FetchResult.failed(url, -1, "cancelled");
                }
                return ok(url, page("late"));
            };

            long t0 = System.nanoTime();
            DiscoveryBrief brief = new DiscoveryService(cfg().setRunTimeBudgetMs(300), hanging).run();
            long ms = (System.nanoTime() - t0) / 1_000_000;

            assertThat(ms).isLessThan(5_000);
            assertThat(brief.getPages()).hasSize(1);
            assertThat(brief.getFetchErrors()).hasSize(2)
                    .allSatisfy(e -> assertThat(e.getError()).isEqualTo(DiscoveryService.CANCELLED));
            // 중단된 fetch는 요청/실패 수에 들어가지 않고 취소로 한 번만 집계된다
            assertThat(brief.getStats().requestsTotal).isEqualTo(1);
            assertThat(brief.getStats().failuresTotal).isZero();
            assertThat(brief.getStats().cancelled).isEqualTo(2);
        }

        @Test
        @DisplayName("느린 홈페이지도 실행 예산에 묶인다 → FetchFailureException(cancelled)")
        void deadline_during_slow_homepage_fails_fast() {
            IPageFetcher slowHome = url -> {
                try {
                    Thread.sleep(3_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return FetchResult.failed(url, -1, "cancelled");
                }
                return ok(url, page("late home"));
            };
            DiscoveryService svc = new DiscoveryService(cfg().setRunTimeBudgetMs(300), slowHome);

            long t0 = System.nanoTime();
            assertThatThrownBy(svc::run)
                    .isInstanceOf(FetchFailureException.class)
                    .satisfies(e -> assertThat(((FetchFailureException) e).getResult().getError())
                            .isEqualTo(DiscoveryService.CANCELLED));
            long ms = (System.nanoTime() - t0) / 1_000_000;

            assertThat(ms).isLessThan(2_000);
            assertThat(svc.getRuntimeSnapshot().cancelled).isEqualTo(1);
            assertThat(svc.getRuntimeSnapshot().requestsTotal).isZero();
        }

        @Test
        void cancel_during_homepage_fetch_throws() {
            AtomicBoolean cancel = new AtomicBoolean(false);
            IPageFetcher f = url -> {
                cancel.set(true);
                try { Thread.sleep(3_000); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
                return FetchResult.failed(url, -1, "cancelled");
            };
            DiscoveryService svc = new DiscoveryService(cfg(), f);

            long t0 = System.nanoTime();
            assertThatThrownBy(() -> svc.run(null, cancel))
                    .isInstanceOf(CancellationException.class)
                    .hasMessageContaining("homepage");
            assertThat((System.nanoTime() - t0) / 1_000_000).isLessThan(2_000);
            assertThat(svc.getRuntimeSnapshot().cancelled).isEqualTo(1);
        }

        @Test
        void cancel_before_homepage_throws() {
            MapFetcher f = new MapFetcher().put(ok(HOME, page("")));
            DiscoveryService svc = new DiscoveryService(cfg(), f);

            assertThatThrownBy(() -> svc.run(null, new AtomicBoolean(true)))
                    .isInstanceOf(CancellationException.class);
            assertThat(f.requested).isEmpty();
        }

        @Test
        void cancel_during_fetch_keeps_homepage() {
            AtomicBoolean cancel = new AtomicBoolean(false);
            IPageFetcher f = url -> {
                if (url.equals(HOME)) return ok(HOME, page("", "/a", "/b", "/c"));
                cancel.set(true);
                try { Thread.sleep(2_000); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
                return FetchResult.failed(url, -1, "cancelled");
            };

            DiscoveryBrief brief = new DiscoveryService(cfg().setConcurrency(1), f).run(null, cancel);

            assertThat(brief.getPages()).hasSize(1);
            assertThat(brief.getFetchErrors()).hasSize(3);
        }
    }

    @Test
    void progress_listener_sees_phases_and_failures_are_ignored() {
        MapFetcher f = new MapFetcher().put(ok(HOME, page("", "/a"))).put(ok(u("/a"), page("a")));
        Set<String> phases = ConcurrentHashMap.newKeySet();
        AtomicInteger calls = new AtomicInteger();

        new DiscoveryService(cfg(), f).run((p, phase, done, total) -> {
            phases.add(phase);
            if (calls.incrementAndGet() == 2) throw new IllegalStateException("listener bug");
        });

        assertThat(phases).contains("normalize", "homepage", "frontier", "fetch", "assemble");
    }
}
