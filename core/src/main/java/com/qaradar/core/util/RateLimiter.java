package com.qaradar.core.util;

import com.qaradar.core.model.DiscoveryConfig;

import java.util.Objects;

/**
 * 대상 origin 하나에 대한 요청 속도 제한(토큰 버킷).
 * 한 실행의 모든 fetch(홈페이지 포함)가 같은 버킷을 공유한다.
 * acquire는 인터럽트에 반응하므로 데드라인/취소 시 대기 중인 워커도 바로 빠진다.
 */
public final class RateLimiter {
    private final long burst;
    private final long perSecond;
    private double available;
    private long lastRefillNs;

    public RateLimiter(long burst, long perSecond) {
        if (burst < 1 || perSecond < 1) {
            throw new IllegalArgumentException("burst and perSecond must be >= 1");
        }
        this.burst = burst;
        this.perSecond = perSecond;
        this.available = burst;
        this.lastRefillNs = System.nanoTime();
    }

    /**
     * 설정 기반 origin 버킷: 초당 rps, 순간 버스트는 워커 수를 넘지 않게 min(rps, concurrency).
     * 시작 직후 워커 전원이 동시에 나가는 것 이상으로 몰리지 않는다.
     */
    public static RateLimiter forOrigin(DiscoveryConfig config) {
        Objects.requireNonNull(config, "config");
        long rps = Math.max(1, config.getRps());
        long cc = Math.max(1, config.getConcurrency());
        return new RateLimiter(Math.min(rps, cc), rps);
    }

    public synchronized void acquire() throws InterruptedException {
        while (true) {
            refill();
            if (available >= 1.0) {
                available -= 1.0;
                return;
            }
            // 다음 토큰까지 남은 시간만큼만 잠깐 대기
            long waitMs = (long) Math.ceil((1.0 - available) * 1000.0 / perSecond);
            this.wait(Math.max(1, Math.min(waitMs, 50)));
        }
    }

    /** 대기 없이 토큰을 얻으면 true */
    public synchronized boolean tryAcquire() {
        refill();
        if (available < 1.0) return false;
        available -= 1.0;
        return true;
    }

    public long getBurst() { return burst; }
    public long getPerSecond() { return perSecond; }

    private void refill() {
        long now = System.nanoTime();
        double earned = (now - lastRefillNs) / 1_000_000_000.0 * perSecond;
        if (earned > 0) {
            available = Math.min(burst, available + earned);
            lastRefillNs = now;
        }
    }
}
