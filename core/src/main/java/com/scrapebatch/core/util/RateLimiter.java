package com.scrapebatch.core.util;

/**
 * 토큰 버킷. fetch 사이 최소 간격(예의상 pause)을 맞추는 용도.
 * refillPerSecond <= 0 이면 비활성(acquire 즉시 통과).
 */
public final class RateLimiter {
    private final double capacity;
    private final double refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(double capacity, double refillPerSecond) {
        this.capacity = Math.max(1.0, capacity);
        this.refillPerSecond = refillPerSecond;
        this.tokens = this.capacity;
        this.lastNs = System.nanoTime();
    }

    public static RateLimiter unlimited() {
        return new RateLimiter(1, 0);
    }

    public boolean isEnabled() {
        return refillPerSecond > 0;
    }

    public synchronized void acquire() throws InterruptedException {
        if (!isEnabled()) return;
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            this.wait(5);
        }
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
