package com.qaradar.core.util;

import com.qaradar.core.model.DiscoveryConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    @Test
    void burst_up_to_capacity_then_empty() {
        RateLimiter rl = new RateLimiter(3, 1);
        assertTrue(rl.tryAcquire());
        assertTrue(rl.tryAcquire());
        assertTrue(rl.tryAcquire());
        assertFalse(rl.tryAcquire(), "4th token within the same instant must not be available");
    }

    @Test
    void invalid_arguments_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, 5));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(5, 0));
    }

    @Test
    void acquire_waits_for_next_token_once_burst_is_spent() throws Exception {
        RateLimiter rl = new RateLimiter(1, 50); // 20ms마다 1토큰
        long t0 = System.nanoTime();
        rl.acquire();
        rl.acquire(); // 대기 발생
        long ms = (System.nanoTime() - t0) / 1_000_000;
        assertTrue(ms >= 10, "second acquire should wait for a refill, waited " + ms + "ms");
        assertTrue(ms < 2000, "wait must stay bounded by the refill interval, waited " + ms + "ms");
    }

    @Test
    void acquire_is_interruptible() throws Exception {
        RateLimiter rl = new RateLimiter(1, 1);
        rl.acquire();
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, rl::acquire);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void forOrigin_caps_burst_at_concurrency() {
        RateLimiter rl = RateLimiter.forOrigin(DiscoveryConfig.defaults().setRps(5).setConcurrency(4));
        assertEquals(4, rl.getBurst());
        assertEquals(5, rl.getPerSecond());
    }

    @Test
    void forOrigin_low_rps_allows_single_burst() {
        RateLimiter rl = RateLimiter.forOrigin(DiscoveryConfig.defaults().setRps(1).setConcurrency(4));
        assertEquals(1, rl.getBurst());
        assertTrue(rl.tryAcquire());
        assertFalse(rl.tryAcquire());
    }
}
