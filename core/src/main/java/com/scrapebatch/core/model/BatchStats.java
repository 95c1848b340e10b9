package com.scrapebatch.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 배치 런타임 카운터 (스레드 세이프). */
public final class BatchStats {
    private final AtomicLong fetches     = new AtomicLong(0); // 실제 fetch 호출 수(캐시 미스)
    private final AtomicLong memoryHits  = new AtomicLong(0); // 메모리/진행중 fetch 공유
    private final AtomicLong diskHits    = new AtomicLong(0); // 이미 있던 durable entry 로드
    private final AtomicLong fetchFailures = new AtomicLong(0);
    private final AtomicLong processed   = new AtomicLong(0); // (item x template) 처리 수
    private final AtomicLong processFailures = new AtomicLong(0);
    private final AtomicLong sumFetchMs  = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addFetch(long elapsedMs) {
        fetches.incrementAndGet();
        sumFetchMs.addAndGet(Math.max(0, elapsedMs));
    }
    public void addMemoryHit()     { memoryHits.incrementAndGet(); }
    public void addDiskHit()       { diskHits.incrementAndGet(); }
    public void addFetchFailure()  { fetchFailures.incrementAndGet(); }
    public void addProcessed()     { processed.incrementAndGet(); }
    public void addProcessFailure(){ processFailures.incrementAndGet(); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public long fetches()       { return fetches.get(); }
    public long memoryHits()    { return memoryHits.get(); }
    public long diskHits()      { return diskHits.get(); }
    public long fetchFailures() { return fetchFailures.get(); }

    public Snapshot snapshot() {
        long f = fetches.get();
        long avg = f == 0 ? 0 : sumFetchMs.get() / f;
        return new Snapshot(f, memoryHits.get(), diskHits.get(), fetchFailures.get(),
                processed.get(), processFailures.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long fetches;
        public final long memoryHits;
        public final long diskHits;
        public final long fetchFailures;
        public final long processed;
        public final long processFailures;
        public final int  maxObservedConcurrency;
        public final long avgFetchMs;

        public Snapshot(long fetches, long memoryHits, long diskHits, long fetchFailures,
                        long processed, long processFailures, int maxObservedConcurrency, long avgFetchMs) {
            this.fetches = fetches;
            this.memoryHits = memoryHits;
            this.diskHits = diskHits;
            this.fetchFailures = fetchFailures;
            this.processed = processed;
            this.processFailures = processFailures;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.avgFetchMs = avgFetchMs;
        }
    }
}
