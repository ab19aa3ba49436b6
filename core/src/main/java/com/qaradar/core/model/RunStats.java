package com.qaradar.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 실행 텔레메트리 누적기 (스레드 세이프). */
public final class RunStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);   // 홈페이지 포함 GET 시도 수
    private final AtomicLong failuresTotal = new AtomicLong(0);
    private final AtomicLong sumFetchMs = new AtomicLong(0);
    private final AtomicInteger cancelled = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void recordFetch(FetchResult r) {
        requestsTotal.incrementAndGet();
        sumFetchMs.addAndGet(Math.max(0, r.getElapsedMs()));
        if (!r.isUsable()) failuresTotal.incrementAndGet();
    }

    public void recordCancelled() {
        cancelled.incrementAndGet();
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long req = requestsTotal.get();
        long avg = sumFetchMs.get() / Math.max(1, req);
        return new Snapshot(req, failuresTotal.get(), cancelled.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long failuresTotal;
        public final int cancelled;
        public final int maxObservedConcurrency;
        public final long avgFetchMs;

        public Snapshot(long requestsTotal, long failuresTotal, int cancelled, int maxObservedConcurrency, long avgFetchMs) {
            this.requestsTotal = requestsTotal;
            this.failuresTotal = failuresTotal;
            this.cancelled = cancelled;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.avgFetchMs = avgFetchMs;
        }
    }
}
