package com.qaradar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qaradar.core.config.Doctrine;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 한 번의 실행 결과(집계 루트). 조립 후 읽기 전용.
 * 표현/내보내기 계층은 attention band, confidence를 다시 계산하지 않는다.
 */
@JsonPropertyOrder({"origin", "discovery_health", "archetype", "strict_mode", "pages", "fetch_errors",
        "timestamp", "doctrine", "stats"})
public final class DiscoveryBrief {
    private final Origin origin;
    private final DiscoveryHealth discoveryHealth;
    private final Archetype archetype;
    private final boolean strictMode;
    private final List<PageRecord> pages;          // 도메인별로 묶인 순서
    private final List<FetchError> fetchErrors;
    private final Instant timestamp;
    private final Doctrine doctrine;
    private final RunStats.Snapshot stats;

    private DiscoveryBrief(Builder b) {
        this.origin = b.origin;
        this.discoveryHealth = b.discoveryHealth;
        this.archetype = b.archetype;
        this.strictMode = b.strictMode;
        this.pages = List.copyOf(b.pages);
        this.fetchErrors = List.copyOf(b.fetchErrors);
        this.timestamp = (b.timestamp == null ? Instant.now() : b.timestamp);
        this.doctrine = b.doctrine;
        this.stats = b.stats;
    }

    public Origin getOrigin() { return origin; }
    public DiscoveryHealth getDiscoveryHealth() { return discoveryHealth; }
    public Archetype getArchetype() { return archetype; }
    public boolean isStrictMode() { return strictMode; }
    public List<PageRecord> getPages() { return pages; }
    public List<FetchError> getFetchErrors() { return fetchErrors; }
    public Instant getTimestamp() { return timestamp; }
    public Doctrine getDoctrine() { return doctrine; }
    public RunStats.Snapshot getStats() { return stats; }

    /** 특정 도메인의 페이지(삽입 순서 유지) */
    public List<PageRecord> pagesIn(TrustDomain domain) {
        return pages.stream()
                .filter(p -> p.getTrustDomain() == domain)
                .collect(Collectors.toUnmodifiableList());
    }

    @JsonIgnore
    public int getPageCount() { return pages.size(); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private Origin origin;
        private DiscoveryHealth discoveryHealth;
        private Archetype archetype = Archetype.GENERAL;
        private boolean strictMode;
        private List<PageRecord> pages = List.of();
        private List<FetchError> fetchErrors = List.of();
        private Instant timestamp;
        private Doctrine doctrine = Doctrine.DEFAULT;
        private RunStats.Snapshot stats;

        public Builder origin(Origin origin) { this.origin = origin; return this; }
        public Builder discoveryHealth(DiscoveryHealth h) { this.discoveryHealth = h; return this; }
        public Builder archetype(Archetype archetype) { this.archetype = archetype; return this; }
        public Builder strictMode(boolean strictMode) { this.strictMode = strictMode; return this; }
        public Builder pages(List<PageRecord> pages) { this.pages = (pages == null ? List.of() : pages); return this; }
        public Builder fetchErrors(List<FetchError> errs) { this.fetchErrors = (errs == null ? List.of() : errs); return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder doctrine(Doctrine doctrine) { this.doctrine = doctrine; return this; }
        public Builder stats(RunStats.Snapshot stats) { this.stats = stats; return this; }

        public DiscoveryBrief build() {
            Objects.requireNonNull(origin, "origin");
            Objects.requireNonNull(discoveryHealth, "discoveryHealth");
            Objects.requireNonNull(archetype, "archetype");
            Objects.requireNonNull(doctrine, "doctrine");
            return new DiscoveryBrief(this);
        }
    }
}
