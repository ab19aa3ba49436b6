package com.qaradar.core.service;

import com.qaradar.core.api.IPageFetcher;
import com.qaradar.core.api.ISignalDetector;
import com.qaradar.core.classify.TrustDomainClassifier;
import com.qaradar.core.config.ReviewPrompts;
import com.qaradar.core.crawler.Frontier;
import com.qaradar.core.crawler.JsoupLinkExtractor;
import com.qaradar.core.crawler.LinkExtractor;
import com.qaradar.core.http.HttpPageFetcher;
import com.qaradar.core.model.DiscoveryBrief;
import com.qaradar.core.model.DiscoveryConfig;
import com.qaradar.core.model.FetchError;
import com.qaradar.core.model.FetchFailureException;
import com.qaradar.core.model.FetchResult;
import com.qaradar.core.model.InvalidConfigurationException;
import com.qaradar.core.model.Origin;
import com.qaradar.core.model.PageRecord;
import com.qaradar.core.model.RunStats;
import com.qaradar.core.model.Signal;
import com.qaradar.core.model.TrustDomain;
import com.qaradar.core.scanner.RuleTableSignalDetector;
import com.qaradar.core.severity.Proposal;
import com.qaradar.core.severity.SeverityProposer;
import com.qaradar.core.util.ProgressListener;
import com.qaradar.core.util.RateLimiter;
import com.qaradar.core.util.StructuredLog;
import com.qaradar.core.util.UrlExclusion;
import com.qaradar.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 디스커버리 오케스트레이터:
 *  - normalize → homepage fetch → link 추출 → frontier → 나머지 fetch → 분류/탐지/제안 → 브리프 조립
 *  - 홈페이지 이후 fetch는 고정 크기 스레드풀(동시성=concurrency) + origin 단위 RateLimiter
 *  - 결과는 완료 순서와 무관하게 frontier 순서로 재정렬
 *  - 데드라인/취소 시 남은 fetch를 중단하고 부분 브리프를 돌려준다
 *
 * 재시도는 하지 않는다. 실패한 fetch는 기록만 된다.
 */
public final class DiscoveryService {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryService.class);
    private static final StructuredLog SLOG = StructuredLog.get(DiscoveryService.class);

    static final String CANCELLED = "cancelled";
    private static final long POLL_SLICE_MS = 50;

    private final DiscoveryConfig config;
    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;
    private final ISignalDetector detector;
    private final TrustDomainClassifier classifier;
    private final SeverityProposer proposer;
    private final BriefAssembler assembler;
    private final RateLimiter rateLimiter;
    private final UrlExclusion exclusion;

    private volatile RunStats lastStats = new RunStats();

    /** 기본 구현 */
    public DiscoveryService(DiscoveryConfig config) {
        this(validated(config), new HttpPageFetcher(config));
    }

    /** fetcher만 교체(테스트/스텁용) */
    public DiscoveryService(DiscoveryConfig config, IPageFetcher fetcher) {
        this(config, fetcher, new JsoupLinkExtractor(), new RuleTableSignalDetector(),
                new TrustDomainClassifier(), new SeverityProposer(), new BriefAssembler());
    }

    /** DI/테스트용 */
    public DiscoveryService(DiscoveryConfig config,
                            IPageFetcher fetcher,
                            LinkExtractor extractor,
                            ISignalDetector detector,
                            TrustDomainClassifier classifier,
                            SeverityProposer proposer,
                            BriefAssembler assembler) {
        this.config = validated(config);
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.proposer = Objects.requireNonNull(proposer, "proposer");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.rateLimiter = RateLimiter.forOrigin(config);
        try {
            this.exclusion = UrlExclusion.compile(config.getExcludePaths());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(e.getMessage());
        }
    }

    private static DiscoveryConfig validated(DiscoveryConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }

    /* =========================
       실행 API
       ========================= */

    public DiscoveryBrief run() {
        return run(ProgressListener.NONE, null);
    }

    public DiscoveryBrief run(ProgressListener listener) {
        return run(listener, null);
    }

    /**
     * @param cancelFlag true가 되면 진행 중 fetch를 중단하고 부분 브리프 반환(홈페이지 완료 전이면 CancellationException)
     * @throws com.qaradar.core.model.InvalidInputException origin 문자열이 비었거나 해석 불가
     * @throws FetchFailureException 홈페이지를 사용할 수 없음(데드라인 초과 포함, error="cancelled")
     */
    public DiscoveryBrief run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final RunStats stats = new RunStats();
        this.lastStats = stats;
        final long deadlineNs = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getRunTimeBudgetMs());

        // ---- 0) origin 정규화 (네트워크 없음) ----
        notify(pl, 0.0, ProgressListener.PHASE_NORMALIZE, 0, -1);
        final URI originUrl = UrlUtils.normalizeOrigin(config.getTarget());

        LOG.info("Discovery start: origin={}, maxPages={}, strict={}, cc={}, rps={}",
                originUrl, config.getMaxPages(), config.isStrictMode(), config.getConcurrency(), config.getRps());
        SLOG.info("discovery-start",
                "origin", originUrl,
                "maxPages", config.getMaxPages(),
                "strict", config.isStrictMode(),
                "cc", config.getConcurrency());

        // ---- 1) 홈페이지 (실패 시 전체 중단) ----
        checkCancel(cancelFlag);
        notify(pl, 0.0, ProgressListener.PHASE_HOMEPAGE, 0, 1);
        final FetchResult home = fetchHomepage(originUrl, stats, cancelFlag, deadlineNs);
        if (!home.isUsable()) {
            LOG.warn("Homepage unusable: {} -> {}", originUrl, home.getError());
            SLOG.warn("fetch-failed", "url", originUrl, "status", home.getStatus(), "error", home.getError(), "fatal", true);
            throw new FetchFailureException(home);
        }

        final URI homeUrl = UrlUtils.canonicalize(home.getFinalUrl());
        final Origin origin = Origin.of(homeUrl);
        SLOG.info("homepage-fetched", "url", homeUrl, "status", home.getStatus(), "ms", home.getElapsedMs());

        // ---- 2) frontier ----
        notify(pl, 0.0, ProgressListener.PHASE_FRONTIER, 0, -1);
        final List<URI> frontier = Frontier.bound(homeUrl, candidateLinks(home), config.getMaxPages());
        SLOG.info("frontier-bounded", "size", frontier.size(), "maxPages", config.getMaxPages());

        // ---- 3) 나머지 fetch (병렬, frontier는 읽기 전용) ----
        final List<URI> targets = frontier.subList(1, frontier.size());
        final List<FetchResult> fetched = fetchAll(targets, stats, cancelFlag, deadlineNs, pl);

        // ---- 4) frontier 순서대로 분류/탐지/제안 ----
        final List<PageRecord> records = new ArrayList<>(frontier.size());
        final List<FetchError> errors = new ArrayList<>();
        final Set<URI> analysed = new HashSet<>();

        analysed.add(homeUrl);
        records.add(analyse(homeUrl, home.getBody()));

        for (FetchResult r : fetched) {
            if (!r.isUsable()) {
                errors.add(r.toFetchError());
                SLOG.info("fetch-failed", "url", r.getUrl(), "status", r.getStatus(), "error", r.getError());
                continue;
            }
            URI pageUrl = UrlUtils.canonicalize(r.getFinalUrl());
            if (pageUrl == null || !origin.contains(pageUrl)) {
                errors.add(new FetchError(r.getUrl(), r.getStatus(), "Redirected off-origin to " + r.getFinalUrl()));
                continue;
            }
            if (!analysed.add(pageUrl)) {
                LOG.debug("Skip duplicate final URL {} (requested {})", pageUrl, r.getUrl());
                continue;
            }
            records.add(analyse(pageUrl, r.getBody()));
        }

        // ---- 5) 조립 ----
        notify(pl, 1.0, ProgressListener.PHASE_ASSEMBLE, records.size(), frontier.size());
        DiscoveryBrief brief = assembler.assemble(origin, records, errors, home.getBody(),
                config.isStrictMode(), stats.snapshot());

        LOG.info("Discovery done. origin={}, pages={}, errors={}, health={}",
                origin, records.size(), errors.size(), brief.getDiscoveryHealth());
        SLOG.info("discovery-done",
                "origin", origin,
                "pages", records.size(),
                "errors", errors.size(),
                "health", brief.getDiscoveryHealth().label(),
                "maxObservedCC", stats.snapshot().maxObservedConcurrency);
        return brief;
    }

    /* =========================
       단계별 헬퍼
       ========================= */

    /** 홈페이지에서 추출한 링크 중 정적 리소스/제외 규칙 해당분을 뺀다 */
    private List<URI> candidateLinks(FetchResult home) {
        Set<URI> links = extractor.extract(home.getBody(), home.getFinalUrl());
        List<URI> out = new ArrayList<>(links.size());
        for (URI u : links) {
            if (config.isSkipStaticAssets() && UrlUtils.isStaticAsset(u)) continue;
            if (exclusion.isExcluded(u)) continue;
            out.add(u);
        }
        LOG.debug("Links: extracted={}, kept={}", links.size(), out.size());
        return out;
    }

    private PageRecord analyse(URI url, String html) {
        TrustDomain domain = classifier.classify(url);
        List<Signal> signals = detector.detect(html);
        Proposal p = proposer.propose(signals, config.isStrictMode());
        SLOG.debug("page-analysed",
                "url", url,
                "domain", domain.label(),
                "signals", signals.size(),
                "band", p.band().label(),
                "confidence", p.confidence().label());
        return new PageRecord(url, domain, signals, p.band(), p.confidence(), ReviewPrompts.forDomain(domain));
    }

    /**
     * 홈페이지도 데드라인/취소 대상이다.
     * 취소 플래그면 CancellationException, 데드라인이면 "cancelled" 실패 결과(호출자가 FetchFailureException으로 올림).
     */
    private FetchResult fetchHomepage(URI originUrl, RunStats stats, AtomicBoolean cancelFlag, long deadlineNs) {
        ExecutorService exec = Executors.newSingleThreadExecutor(new NamedThreadFactory("discovery-home"));
        try {
            Future<FetchResult> f = exec.submit(() -> fetchPolitely(originUrl, stats));
            FetchResult r = await(f, originUrl, cancelFlag, deadlineNs);
            if (r != null && !CANCELLED.equals(r.getError())) return r;

            f.cancel(true);
            stats.recordCancelled();
            if (isCancelled(cancelFlag)) {
                throw new CancellationException("discovery cancelled during homepage fetch");
            }
            LOG.warn("Run deadline ({}ms) reached during homepage fetch: {}", config.getRunTimeBudgetMs(), originUrl);
            return FetchResult.failed(originUrl, -1, CANCELLED);
        } finally {
            exec.shutdownNow();
        }
    }

    /** 중단된 fetch는 요청 통계에 넣지 않는다(취소 집계는 수집 쪽에서 한 번만) */
    private FetchResult fetchPolitely(URI url, RunStats stats) {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return FetchResult.failed(url, -1, CANCELLED);
        }
        FetchResult r = fetcher.fetch(url);
        if (!CANCELLED.equals(r.getError())) stats.recordFetch(r);
        return r;
    }

    /**
     * 고정 스레드풀로 fetch 후 입력 순서 그대로 결과를 돌려준다.
     * 데드라인/취소에 걸린 항목은 "cancelled" 실패로 채운다.
     */
    private List<FetchResult> fetchAll(List<URI> targets, RunStats stats, AtomicBoolean cancelFlag,
                                       long deadlineNs, ProgressListener pl) {
        final int total = targets.size();
        if (total == 0) return List.of();

        final int cc = Math.max(1, Math.min(config.getConcurrency(), total));
        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("discovery-fetch"));

        final AtomicInteger inFlight = new AtomicInteger(0);
        final AtomicInteger done = new AtomicInteger(0);
        final List<Future<FetchResult>> futures = new ArrayList<>(total);
        notify(pl, 0.0, ProgressListener.PHASE_FETCH, 0, total);

        for (URI url : targets) {
            futures.add(exec.submit(() -> {
                if (isCancelled(cancelFlag)) {
                    return FetchResult.failed(url, -1, CANCELLED);
                }
                int cur = inFlight.incrementAndGet();
                stats.observeConcurrency(cur);
                try {
                    LOG.debug("Fetch: {}", url);
                    return fetchPolitely(url, stats);
                } finally {
                    inFlight.decrementAndGet();
                    int d = done.incrementAndGet();
                    notify(pl, (double) d / total, ProgressListener.PHASE_FETCH, d, total);
                }
            }));
        }

        final List<FetchResult> results = new ArrayList<>(total);
        boolean aborted = false;
        try {
            for (int i = 0; i < total; i++) {
                URI url = targets.get(i);
                Future<FetchResult> f = futures.get(i);
                if (!aborted) {
                    FetchResult r = await(f, url, cancelFlag, deadlineNs);
                    if (r != null) {
                        if (CANCELLED.equals(r.getError())) stats.recordCancelled();
                        results.add(r);
                        continue;
                    }
                    aborted = true;
                    LOG.warn("Discovery interrupted (deadline or cancel); remaining fetches are cancelled");
                    SLOG.warn("discovery-aborted", "completed", i, "total", total);
                }
                f.cancel(true);
                results.add(collectAfterAbort(f, url, stats));
            }
        } finally {
            exec.shutdownNow();
            try {
                if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                    LOG.warn("Fetch workers did not terminate within 5s");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        return results;
    }

    /** 완료될 때까지 조금씩 기다린다. 데드라인/취소면 null */
    private static FetchResult await(Future<FetchResult> f, URI url, AtomicBoolean cancelFlag, long deadlineNs) {
        while (true) {
            if (isCancelled(cancelFlag)) return null;
            long remaining = deadlineNs - System.nanoTime();
            if (remaining <= 0) return null;
            long slice = Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_SLICE_MS));
            try {
                return f.get(slice, TimeUnit.NANOSECONDS);
            } catch (TimeoutException te) {
                // 다음 조각
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return null;
            } catch (ExecutionException e) {
                // fetcher 계약 위반(예외 전파)도 이 URL의 실패로만 기록
                Throwable cause = (e.getCause() != null ? e.getCause() : e);
                LOG.warn("Fetch task failed: {} ({})", url, cause.toString());
                SLOG.error("task-failed", cause, "url", url);
                return FetchResult.failed(url, -1, "Request failed: " + cause.getClass().getSimpleName());
            } catch (CancellationException ce) {
                return null;
            }
        }
    }

    /** 중단 이후: 이미 끝난 작업은 결과를 쓰고, 아니면 cancelled로 기록 */
    private static FetchResult collectAfterAbort(Future<FetchResult> f, URI url, RunStats stats) {
        if (f.isDone() && !f.isCancelled()) {
            try {
                FetchResult r = f.get();
                if (r != null) {
                    if (CANCELLED.equals(r.getError())) stats.recordCancelled();
                    return r;
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | CancellationException e) {
                LOG.debug("Late result unavailable for {}: {}", url, e.toString());
            }
        }
        stats.recordCancelled();
        return FetchResult.failed(url, -1, CANCELLED);
    }

    /* =========================
       공용 유틸 / 게터
       ========================= */

    private static boolean isCancelled(AtomicBoolean flag) {
        return Thread.currentThread().isInterrupted() || (flag != null && flag.get());
    }

    private static void checkCancel(AtomicBoolean flag) {
        if (isCancelled(flag)) throw new CancellationException("discovery cancelled before homepage fetch");
    }

    private static void notify(ProgressListener pl, double p, String phase, long done, long total) {
        try {
            pl.onProgress(Math.max(0.0, Math.min(1.0, p)), phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    public RunStats.Snapshot getRuntimeSnapshot() {
        return lastStats.snapshot();
    }

    public DiscoveryConfig getConfig() {
        return config;
    }
}
