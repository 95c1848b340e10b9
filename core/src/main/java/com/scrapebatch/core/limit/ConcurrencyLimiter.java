package com.scrapebatch.core.limit;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 비싼 작업(fetch)의 동시 실행 수 상한 N.
 * 어떤 시점에도 N개를 넘는 보유자는 없다. 획득보다 많이 반납하면 IllegalStateException.
 */
public final class ConcurrencyLimiter {
    private final int capacity;
    private final Semaphore permits;
    private final AtomicInteger inUse = new AtomicInteger(0);
    private final AtomicInteger maxObserved = new AtomicInteger(0);

    public ConcurrencyLimiter(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    public int capacity() { return capacity; }
    public int inUse() { return inUse.get(); }
    public int available() { return permits.availablePermits(); }
    public int maxObserved() { return maxObserved.get(); }

    /** 슬롯이 날 때까지 대기(인터럽트 가능) */
    public void acquire() throws InterruptedException {
        permits.acquire();
        int now = inUse.incrementAndGet();
        maxObserved.accumulateAndGet(now, Math::max);
    }

    public void release() {
        // 반납은 보유 수를 먼저 깎아 초과 반납을 잡는다
        int before = inUse.getAndUpdate(v -> v > 0 ? v - 1 : v);
        if (before <= 0) {
            throw new IllegalStateException("release without matching acquire");
        }
        permits.release();
    }

    /** try-with-resources 용 슬롯. close는 여러 번 불러도 한 번만 반납 */
    public Permit enter() throws InterruptedException {
        acquire();
        return new Permit();
    }

    /** 슬롯을 잡고 work 실행, 어떤 경로로 끝나든 반납 */
    public <T> T call(Callable<T> work) throws Exception {
        Objects.requireNonNull(work, "work");
        try (Permit ignored = enter()) {
            return work.call();
        }
    }

    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {}

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) release();
        }
    }
}
