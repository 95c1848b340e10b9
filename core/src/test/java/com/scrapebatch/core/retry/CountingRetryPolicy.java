package com.scrapebatch.core.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/** 테스트용: RetryPolicy를 감싸 재시도 횟수를 집계하는 데코레이터. */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private final AtomicInteger retries = new AtomicInteger(); // shouldRetry(...)가 true를 반환한 횟수

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(Throwable failure, int attempt) {
        boolean ok = delegate.shouldRetry(failure, attempt);
        if (ok) retries.incrementAndGet();
        return ok;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    /** 지금까지 실제 발생한 재시도 횟수(0 이상). 여러 스레드가 공유해도 안전. */
    public int getRetryCount() {
        return retries.get();
    }
}
