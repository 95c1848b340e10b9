package com.scrapebatch.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    @Test
    void unlimited_never_blocks() throws Exception {
        RateLimiter rl = RateLimiter.unlimited();
        assertFalse(rl.isEnabled());
        long t0 = System.nanoTime();
        for (int i = 0; i < 10_000; i++) rl.acquire();
        assertTrue(System.nanoTime() - t0 < 2_000_000_000L);
    }

    @Test
    void paces_after_burst() throws Exception {
        RateLimiter rl = new RateLimiter(1, 10); // 버스트 1, 초당 10
        assertTrue(rl.isEnabled());
        long t0 = System.nanoTime();
        for (int i = 0; i < 4; i++) rl.acquire();
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        // 첫 토큰은 즉시, 나머지 3개는 각 ~100ms
        assertTrue(ms >= 250, "took " + ms + "ms");
    }
}
