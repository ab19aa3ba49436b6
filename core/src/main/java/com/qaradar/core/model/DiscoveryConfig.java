package com.qaradar.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 디스커버리 실행 설정 (discovery.yml 매핑 대상). 순수 설정 보관용.
 * 기본값: maxPages=10, strictMode=false, concurrency=4, rps=5, timeout=10s.
 */
public final class DiscoveryConfig {

    public static final int DEFAULT_MAX_PAGES = 10;

    // ---------- 기본 필드 ----------
    private String target;                          // origin 문자열 (필수)
    private int maxPages = DEFAULT_MAX_PAGES;       // 홈페이지 포함 상한
    private boolean strictMode = false;             // 판정 모드: true면 더 적극적으로 등급 상향

    private Duration timeout = Duration.ofSeconds(10); // 요청 타임아웃
    private int concurrency = 4;                    // 동시 fetch 상한
    private int rps = 5;                            // 대상 origin 보호용 초당 요청 수
    private boolean followRedirects = true;
    private String userAgent = "QARadar/2.0 (+discovery)";
    private long runTimeBudgetMs = 60_000;          // 전체 실행 데드라인

    // ---------- scope ----------
    private boolean skipStaticAssets = true;
    private List<String> excludePaths = List.of();

    // ---------- output ----------
    private Path outputDir = Path.of("out");

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxPages() { return maxPages; }
    public boolean isStrictMode() { return strictMode; }
    public Duration getTimeout() { return timeout; }
    public int getConcurrency() { return concurrency; }
    public int getRps() { return rps; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public long getRunTimeBudgetMs() { return runTimeBudgetMs; }
    public boolean isSkipStaticAssets() { return skipStaticAssets; }
    public List<String> getExcludePaths() { return excludePaths; }
    public Path getOutputDir() { return outputDir; }

    // ---------- fluent setters ----------
    // 범위 검증은 validate()에서 한 번에 한다(0/음수도 그대로 보관).
    public DiscoveryConfig setTarget(String target) { this.target = target; return this; }
    public DiscoveryConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public DiscoveryConfig setStrictMode(boolean strictMode) { this.strictMode = strictMode; return this; }
    public DiscoveryConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public DiscoveryConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public DiscoveryConfig setRps(int rps) { this.rps = rps; return this; }
    public DiscoveryConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public DiscoveryConfig setUserAgent(String userAgent) {
        if (userAgent != null && !userAgent.isBlank()) this.userAgent = userAgent.trim();
        return this;
    }
    public DiscoveryConfig setRunTimeBudgetMs(long ms) { this.runTimeBudgetMs = ms; return this; }
    public DiscoveryConfig setSkipStaticAssets(boolean v) { this.skipStaticAssets = v; return this; }
    public DiscoveryConfig setExcludePaths(List<String> paths) {
        this.excludePaths = (paths == null ? List.of() : List.copyOf(paths));
        return this;
    }
    public DiscoveryConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    // ---------- validate ----------
    public void validate() {
        if (target == null || target.isBlank()) throw new InvalidInputException("target must not be empty");
        if (maxPages < 1) throw new InvalidConfigurationException("maxPages must be a positive integer: " + maxPages);
        if (concurrency < 1) throw new InvalidConfigurationException("concurrency must be >= 1");
        if (rps < 1) throw new InvalidConfigurationException("rps must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new InvalidConfigurationException("timeout must be > 0");
        if (runTimeBudgetMs < 1) throw new InvalidConfigurationException("runTimeBudgetMs must be > 0");
        if (outputDir == null) throw new InvalidConfigurationException("outputDir must not be null");
    }

    // ---------- helpers ----------
    public static DiscoveryConfig defaults() { return new DiscoveryConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public DiscoveryConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}
