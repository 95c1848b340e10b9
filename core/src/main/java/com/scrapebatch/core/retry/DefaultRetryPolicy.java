package com.scrapebatch.core.retry;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** IOException에서만 재시도. 1s → 2s → 4s (±10% Jitter) */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 1000); }
    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
    }

    @Override public boolean shouldRetry(Throwable failure, int attempt) {
        if (attempt >= maxAttempts) return false;
        return failure instanceof IOException;
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1)); // 1,2,4...
        long raw = baseMillis * pow;                               // 1000, 2000, 4000...
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2); // ±10%
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
