package com.scrapebatch.core.cache;

import com.scrapebatch.core.api.FetchException;
import com.scrapebatch.core.api.PageFetcher;
import com.scrapebatch.core.model.BatchStats;
import com.scrapebatch.core.store.AtomicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * "한 번만 fetch" 캐시.
 *
 * 키별 상태: Unfetched → Cached | Failed, release 후 소멸.
 * - 같은 키로 N개 스레드가 동시에 들어와도 fetch는 한 번(single-flight).
 * - 이미 durable entry가 있으면 fetch 없이 로드.
 * - 실패는 키에 고정되어 이후 호출자 모두에게 재fetch 없이 전달된다.
 * - 저장 실패는 경고만(메모리 값으로 계속 진행).
 */
public final class FetchCache {
    private static final Logger LOG = LoggerFactory.getLogger(FetchCache.class);

    private final AtomicStore store;
    private final BatchStats stats;
    private final ConcurrentHashMap<CacheKey, Slot> slots = new ConcurrentHashMap<>();

    /** 키 하나의 진행/결과 */
    private static final class Slot {
        final CompletableFuture<String> result = new CompletableFuture<>();
        final AtomicBoolean claimed = new AtomicBoolean(false);
    }

    public FetchCache(AtomicStore store) {
        this(store, new BatchStats());
    }

    public FetchCache(AtomicStore store, BatchStats stats) {
        this.store = Objects.requireNonNull(store, "store");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    public BatchStats stats() { return stats; }

    /**
     * 키에 해당하는 콘텐츠. 최초 호출자만 로드/fetch 하고 나머지는 그 결과를 기다린다.
     *
     * @throws FetchException 이 키의 fetch가 실패했던 경우(재시도 없음)
     */
    public String get(CacheKey key, String url, PageFetcher fetcher) throws FetchException, InterruptedException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(fetcher, "fetcher");

        while (true) {
            Slot slot = slots.computeIfAbsent(key, k -> new Slot());
            if (slot.claimed.compareAndSet(false, true)) {
                load(key, url, fetcher, slot);
            } else {
                stats.addMemoryHit();
            }
            try {
                return slot.result.get();
            } catch (CancellationException e) {
                // 로더가 인터럽트로 빠졌음 → 새 슬롯으로 다시
                continue;
            } catch (ExecutionException e) {
                throw unwrap(url, e.getCause());
            }
        }
    }

    /** 현재 메모리상 상태 (테스트/진단용) */
    public boolean isCached(CacheKey key) {
        Slot s = slots.get(key);
        return s != null && s.result.isDone() && !s.result.isCompletedExceptionally();
    }

    public boolean isFailed(CacheKey key) {
        Slot s = slots.get(key);
        return s != null && s.result.isCompletedExceptionally() && !s.result.isCancelled();
    }

    /**
     * durable entry + 마커 삭제, 메모리에서 제거. 여러 번 불러도, 만든 적 없어도 안전.
     * 삭제 실패는 경고만 남긴다(다음 정리 때 다시 시도).
     */
    public void release(CacheKey key) {
        Objects.requireNonNull(key, "key");
        slots.remove(key);
        deleteQuietly(key.fileName());
        deleteQuietly(key.markerName());
    }

    /** try-with-resources 로 release 보장 */
    public Scope open(CacheKey key) {
        return new Scope(Objects.requireNonNull(key, "key"));
    }

    public final class Scope implements AutoCloseable {
        private final CacheKey key;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Scope(CacheKey key) { this.key = key; }

        public CacheKey key() { return key; }

        public String get(String url, PageFetcher fetcher) throws FetchException, InterruptedException {
            if (closed.get()) throw new IllegalStateException("scope already closed: " + key);
            return FetchCache.this.get(key, url, fetcher);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) release(key);
        }
    }

    // ----------------- internals -----------------

    private void load(CacheKey key, String url, PageFetcher fetcher, Slot slot) throws InterruptedException {
        // 1) 이미 있는 durable entry / 실패 마커
        try {
            Optional<String> existing = store.read(key.fileName());
            if (existing.isPresent()) {
                stats.addDiskHit();
                slot.result.complete(existing.get());
                return;
            }
            Optional<String> marker = store.read(key.markerName());
            if (marker.isPresent()) {
                stats.addFetchFailure();
                slot.result.completeExceptionally(new FetchException(url, "previously failed: " + marker.get()));
                return;
            }
        } catch (IOException e) {
            LOG.warn("cache read failed key={} cause={}, fetching instead", key, e.toString());
        }

        // 2) fetch (이 키에 대해 딱 한 번)
        long t0 = System.nanoTime();
        String content;
        try {
            content = fetcher.fetch(url);
            if (content == null) throw new FetchException(url, "fetcher returned null");
        } catch (FetchException e) {
            stats.addFetchFailure();
            writeMarker(key, e);
            slot.result.completeExceptionally(e);
            return;
        } catch (InterruptedException e) {
            // 실패로 고정하지 않는다: 슬롯을 비워 다음 호출자가 다시 시도
            slots.remove(key, slot);
            slot.result.cancel(false);
            throw e;
        } catch (RuntimeException | Error e) {
            stats.addFetchFailure();
            writeMarker(key, e);
            slot.result.completeExceptionally(e);
            return;
        }
        stats.addFetch((System.nanoTime() - t0) / 1_000_000L);

        // 3) 저장은 best-effort. 공개는 저장 시도 뒤(release가 쓰기보다 먼저 도는 일 방지)
        try {
            store.write(key.fileName(), content);
        } catch (IOException e) {
            LOG.warn("cache persist failed key={} cause={}", key, e.toString());
        } finally {
            slot.result.complete(content);
        }
    }

    private void writeMarker(CacheKey key, Throwable cause) {
        String text = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        try {
            store.write(key.markerName(), text);
        } catch (IOException e) {
            LOG.warn("failure marker not written key={} cause={}", key, e.toString());
        }
    }

    private void deleteQuietly(String name) {
        try {
            store.delete(name);
        } catch (IOException e) {
            LOG.warn("cache cleanup failed name={} cause={}", name, e.toString());
        }
    }

    private static FetchException unwrap(String url, Throwable cause) {
        if (cause instanceof FetchException fe) {
            return new FetchException(fe.getUrl() != null ? fe.getUrl() : url, fe.getMessage(), fe);
        }
        if (cause instanceof RuntimeException re) throw re;
        if (cause instanceof Error err) throw err;
        return new FetchException(url, String.valueOf(cause), cause);
    }
}
