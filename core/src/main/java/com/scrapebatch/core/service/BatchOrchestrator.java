package com.scrapebatch.core.service;

import com.scrapebatch.core.api.FetchException;
import com.scrapebatch.core.api.ItemContext;
import com.scrapebatch.core.api.ItemProcessor;
import com.scrapebatch.core.api.PageFetcher;
import com.scrapebatch.core.api.ProcessingException;
import com.scrapebatch.core.cache.CacheKey;
import com.scrapebatch.core.cache.FetchCache;
import com.scrapebatch.core.cache.KeyComposer;
import com.scrapebatch.core.checkpoint.CheckpointException;
import com.scrapebatch.core.checkpoint.CheckpointStore;
import com.scrapebatch.core.fetch.TimeBoundFetcher;
import com.scrapebatch.core.limit.ConcurrencyLimiter;
import com.scrapebatch.core.lock.SingleInstanceGuard;
import com.scrapebatch.core.model.BatchConfig;
import com.scrapebatch.core.model.BatchResult;
import com.scrapebatch.core.model.BatchStats;
import com.scrapebatch.core.model.ItemOutcome;
import com.scrapebatch.core.model.ProcessResult;
import com.scrapebatch.core.model.RunReport;
import com.scrapebatch.core.model.RunStatus;
import com.scrapebatch.core.model.Template;
import com.scrapebatch.core.model.UnitResult;
import com.scrapebatch.core.model.WorkUnit;
import com.scrapebatch.core.retry.DefaultRetryPolicy;
import com.scrapebatch.core.retry.RetryPolicy;
import com.scrapebatch.core.store.FileAtomicStore;
import com.scrapebatch.core.util.DefaultSleeper;
import com.scrapebatch.core.util.NamedThreadFactory;
import com.scrapebatch.core.util.ProgressListener;
import com.scrapebatch.core.util.RateLimiter;
import com.scrapebatch.core.util.Sleeper;
import com.scrapebatch.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 배치 오케스트레이터:
 *  - 인스턴스 잠금 → 체크포인트 로드(완료 유닛 skip) → 유닛 병렬 처리 → 주기/종료 flush → 잠금 해제
 *  - 유닛 처리: 슬롯 획득 → URL마다 한 번 fetch(FetchCache) → 모든 템플릿 적용 → 체크포인트 기록 → 캐시 정리
 *  - 고정 스레드풀(+역압) + ConcurrencyLimiter로 동시 유닛 수 상한
 *
 * 실패 정책:
 *  - fetch/처리의 checked 예외는 아이템 결과(FETCH_FAILED/PROCESS_FAILED)로 남고 유닛은 계속
 *  - unchecked 예외, 인터럽트, URL이 있는데 하나도 못 가져온 경우 → 유닛 실패(체크포인트 미기록)
 *  - 체크포인트 flush 실패만 실행 전체를 중단시킨다
 */
public final class BatchOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(BatchOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(BatchOrchestrator.class);

    // 캐시 키의 task id. 같은 JVM의 모든 오케스트레이터가 공유해야 키가 겹치지 않는다
    private static final AtomicLong TASK_SEQ = new AtomicLong(0);

    private final BatchConfig config;
    private final PageFetcher fetcher;
    private final ItemProcessor processor;
    private final List<Template> templates;
    private final Sleeper sleeper;

    private final BatchStats stats = new BatchStats();
    private final AtomicBoolean cancel = new AtomicBoolean(false);
    private final AtomicReference<ExecutorService> activePool = new AtomicReference<>();

    public BatchOrchestrator(BatchConfig config, PageFetcher fetcher, ItemProcessor processor, List<Template> templates) {
        this(config, fetcher, processor, templates, new DefaultSleeper());
    }

    /** DI/테스트용: 저장소 재시도 대기를 주입 */
    public BatchOrchestrator(BatchConfig config, PageFetcher fetcher, ItemProcessor processor,
                             List<Template> templates, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.templates = List.copyOf(Objects.requireNonNull(templates, "templates"));
        if (this.templates.isEmpty()) throw new IllegalArgumentException("at least one template required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public BatchStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    /** 새 유닛 투입 중단 + 진행 중 워커 인터럽트. 진행 중이던 유닛은 실패로 남아 다음 실행에서 재처리 */
    public void cancel() {
        if (cancel.compareAndSet(false, true)) {
            LOG.info("Batch cancel requested");
            ExecutorService pool = activePool.get();
            if (pool != null) stopPool(pool);
        }
    }

    public boolean isCancelled() { return cancel.get(); }

    public BatchResult run(String scope, List<WorkUnit> units) throws CheckpointException, IOException {
        return run(scope, units, ProgressListener.NONE);
    }

    /**
     * @param scope 인스턴스 잠금 범위(보통 입력 파일 절대경로)
     * @throws CheckpointException 체크포인트를 기록할 수 없음(진행 상황 유실 위험 → 중단)
     * @throws IOException         인스턴스 잠금 파일 I/O 실패
     */
    public BatchResult run(String scope, List<WorkUnit> units, ProgressListener listener)
            throws CheckpointException, IOException {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(units, "units");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Instant startedAt = Instant.now();

        try (SingleInstanceGuard guard = new SingleInstanceGuard(config.getLockDir(), scope)) {
            if (guard.tryAcquire() == SingleInstanceGuard.Outcome.ALREADY_HELD) {
                LOG.warn("Another instance is already running for scope={} (lock={})", scope, guard.lockFile());
                SLOG.warn("batch-already-running", "scope", scope, "lock", guard.lockFile());
                return new BatchResult(RunReport.alreadyRunning(startedAt), Map.of());
            }
            return runLocked(units, pl, startedAt);
        }
    }

    // ----------------------------------------------------------------

    private BatchResult runLocked(List<WorkUnit> units, ProgressListener pl, Instant startedAt)
            throws CheckpointException {
        RetryPolicy retry = new DefaultRetryPolicy(config.retry().getMaxAttempts(), config.retry().getBaseDelayMs());
        CheckpointStore checkpoint = new CheckpointStore(config.checkpoint().file(), retry, sleeper);
        checkpoint.load();

        // 0) 중복 제거 + 완료 유닛 skip
        Map<String, WorkUnit> byId = new LinkedHashMap<>();
        for (WorkUnit u : units) {
            if (byId.putIfAbsent(u.id(), u) != null) {
                LOG.warn("Duplicate work unit ignored: {}", u.id());
            }
        }
        List<WorkUnit> pending = new ArrayList<>();
        int skipped = 0;
        for (WorkUnit u : byId.values()) {
            if (checkpoint.isCompleted(u.id())) skipped++;
            else pending.add(u);
        }

        final int cc = config.effectiveConcurrency();
        final int workers = Math.max(1, config.effectiveWorkers());
        final int total = pending.size();
        LOG.info("Batch start: units={}, pending={}, skipped={}, cc={}, workers={}, templates={}",
                byId.size(), total, skipped, cc, workers, templates.size());
        SLOG.info("batch-start",
                "units", byId.size(),
                "pending", total,
                "skipped", skipped,
                "cc", cc,
                "workers", workers,
                "templates", templates.size());

        FetchCache cache = new FetchCache(new FileAtomicStore(config.getCacheDir(), retry, sleeper), stats);
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(cc);
        RateLimiter pacing = config.getFetchRps() > 0
                ? new RateLimiter(Math.max(1, config.getFetchRps()), config.getFetchRps())
                : RateLimiter.unlimited();

        final List<String> completed = new ArrayList<>();
        final List<RunReport.FailedUnit> failed = new ArrayList<>();
        final AtomicReference<CheckpointException> flushError = new AtomicReference<>();

        pl.onProgress(0.0, "process", 0, total);

        try (TimeBoundFetcher bounded = new TimeBoundFetcher(fetcher, config.getFetchTimeout())) {
            PageFetcher paced = url -> {
                pacing.acquire();
                return bounded.fetch(url);
            };

            // ---- 1) 고정 스레드풀(+역압) + 주기 flush ----
            ExecutorService exec = new ThreadPoolExecutor(
                    workers, workers,
                    0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(workers * 2),
                    new NamedThreadFactory("batch-worker"),
                    (r, e) -> {
                        if (e.isShutdown()) throw new RejectedExecutionException("pool shut down");
                        try { e.getQueue().put(r); }
                        catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                        }
                        // put 도중 종료됐으면 실행될 일 없는 작업이 큐에 남지 않게
                        if (e.isShutdown() && e.getQueue().remove(r)) {
                            throw new RejectedExecutionException("pool shut down");
                        }
                    }
            );
            activePool.set(exec);
            if (cancel.get()) stopPool(exec); // run 전에 cancel 된 경우

            ScheduledExecutorService flusher = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("checkpoint-flush"));
            long intervalMs = config.checkpoint().getFlushInterval().toMillis();
            flusher.scheduleWithFixedDelay(() -> {
                try {
                    checkpoint.flushIfDirty();
                } catch (CheckpointException e) {
                    onFlushFailure(flushError, e);
                }
            }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

            final AtomicInteger doneUnits = new AtomicInteger(0);
            final int flushEvery = config.checkpoint().getFlushEvery();
            final Map<WorkUnit, Future<UnitResult>> futures = new LinkedHashMap<>();

            try {
                // ---- 2) 작업 제출 ----
                for (WorkUnit unit : pending) {
                    if (cancel.get() || Thread.currentThread().isInterrupted()) break;
                    try {
                        futures.put(unit, exec.submit(() -> {
                            checkCancel();
                            UnitResult result = runUnit(unit, cache, limiter, paced);

                            checkpoint.record(unit.id(), result);
                            if (flushEvery > 0 && checkpoint.pendingSinceFlush() >= flushEvery) {
                                try {
                                    checkpoint.flushIfDirty();
                                } catch (CheckpointException e) {
                                    onFlushFailure(flushError, e);
                                }
                            }

                            int done = doneUnits.incrementAndGet();
                            try {
                                pl.onProgress(Math.min(1.0, (double) done / total), "process", done, total);
                            } catch (RuntimeException e) {
                                LOG.debug("progress listener failed: {}", e.toString());
                            }
                            return result;
                        }));
                    } catch (RejectedExecutionException e) {
                        LOG.info("Unit submission stopped at {}: {}", unit.id(), e.getMessage());
                        break;
                    }
                }

                // ---- 3) 결과 수집 ----
                for (Map.Entry<WorkUnit, Future<UnitResult>> en : futures.entrySet()) {
                    String id = en.getKey().id();
                    try {
                        en.getValue().get();
                        completed.add(id);
                    } catch (CancellationException ce) {
                        failed.add(new RunReport.FailedUnit(id, "cancelled"));
                    } catch (ExecutionException e) {
                        Throwable cause = (e.getCause() != null ? e.getCause() : e);
                        if (cause instanceof CancellationException) {
                            failed.add(new RunReport.FailedUnit(id, "cancelled"));
                            continue;
                        }
                        LOG.warn("Unit failed: unit={}, cause={}", id, cause.toString());
                        SLOG.error("unit-failed", cause, "unit", id, "cause", cause.toString());
                        failed.add(new RunReport.FailedUnit(id, cause.toString()));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        cancel();
                        failed.add(new RunReport.FailedUnit(id, "interrupted"));
                    }
                }
            } finally {
                // ---- 4) 종료 ----
                activePool.set(null);
                stopPool(exec);
                flusher.shutdownNow();
                try {
                    exec.awaitTermination(30, TimeUnit.SECONDS);
                    flusher.awaitTermination(30, TimeUnit.SECONDS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        // 주기 flush 실패는 여기서 실행 중단으로 승격
        CheckpointException periodic = flushError.get();
        if (periodic != null) throw periodic;
        checkpoint.flush();

        boolean cancelled = cancel.get();
        RunStatus status = cancelled ? RunStatus.CANCELLED : RunStatus.COMPLETED;
        Map<String, UnitResult> all = checkpoint.completed();

        if (!cancelled && failed.isEmpty() && !config.checkpoint().isKeep()) {
            try {
                checkpoint.discard();
            } catch (IOException e) {
                LOG.warn("Checkpoint discard failed: {}", e.toString());
            }
        }

        Instant finishedAt = Instant.now();
        RunReport report = new RunReport(status, completed.size() + failed.size(), skipped,
                completed, failed, stats.snapshot(), startedAt, finishedAt);

        pl.onProgress(1.0, "done", completed.size(), total);
        BatchStats.Snapshot s = report.stats();
        LOG.info("Batch done. status={}, completed={}, failed={}, skipped={}, fetches={}, cacheHits={}, maxObservedCC={}",
                status, completed.size(), failed.size(), skipped, s.fetches, s.memoryHits + s.diskHits,
                limiter.maxObserved());
        SLOG.info("batch-done",
                "status", status.name(),
                "completed", completed.size(),
                "failed", failed.size(),
                "skipped", skipped,
                "fetches", s.fetches,
                "memoryHits", s.memoryHits,
                "diskHits", s.diskHits,
                "maxObservedCC", limiter.maxObserved(),
                "elapsedMs", finishedAt.toEpochMilli() - startedAt.toEpochMilli());
        return new BatchResult(report, all);
    }

    /** 유닛 하나: 슬롯을 잡고 URL마다 한 번 fetch 후 모든 템플릿 적용 */
    UnitResult runUnit(WorkUnit unit, FetchCache cache, ConcurrencyLimiter limiter, PageFetcher paced)
            throws UnitFailedException {
        final StructuredLog ulog = SLOG.with("unit", unit.id());
        final KeyComposer keys = KeyComposer.forCurrentProcess("t" + TASK_SEQ.incrementAndGet());
        final List<ItemOutcome> outcomes = new ArrayList<>();
        int fetched = 0;

        try (ConcurrencyLimiter.Permit ignored = limiter.enter()) {
            stats.observeConcurrency(limiter.inUse());
            ulog.debug("unit-start", "items", unit.urls().size());

            // 같은 URL이 두 번 있어도 fetch는 한 번
            List<String> urls = new ArrayList<>(new LinkedHashSet<>(unit.urls()));
            for (int i = 0; i < urls.size(); i++) {
                checkCancel();
                String url = urls.get(i);
                CacheKey key = keys.compose(url, unit.name());

                try (FetchCache.Scope entry = cache.open(key)) {
                    long t0 = System.nanoTime();
                    String content;
                    try {
                        content = entry.get(url, paced);
                    } catch (FetchException e) {
                        long ms = elapsedMs(t0);
                        outcomes.add(ItemOutcome.fetchFailed(url, e.getMessage(), ms));
                        ulog.warn("item", "url", url,
                                "extraction", "failed",
                                "extractionError", e.getMessage(),
                                "textLength", 0,
                                "elapsedMs", ms);
                        continue;
                    }
                    fetched++;
                    long fetchMs = elapsedMs(t0);

                    ItemContext ctx = new ItemContext(unit.name(), url, i, urls.size());
                    for (Template template : templates) {
                        checkCancel();
                        outcomes.add(processOne(ulog, content, template, ctx, fetchMs));
                    }
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while processing unit " + unit.id());
        }

        if (!unit.urls().isEmpty() && fetched == 0) {
            throw new UnitFailedException(unit.id(), "no item could be fetched (" + unit.urls().size() + " url(s))");
        }

        UnitResult result = new UnitResult(unit, Instant.now(), outcomes, ResultMerger.merge(unit.urls(), outcomes));
        LOG.info("Unit done: {} (items={}, outcomes={}, failedItems={})",
                unit.id(), unit.urls().size(), outcomes.size(), result.failedItems());
        ulog.info("unit-done", "items", unit.urls().size(), "outcomes", outcomes.size(),
                "failedItems", result.failedItems());
        return result;
    }

    private ItemOutcome processOne(StructuredLog ulog, String content, Template template, ItemContext ctx,
                                   long fetchMs) throws InterruptedException {
        long t0 = System.nanoTime();
        try {
            ProcessResult r = processor.process(content, template, ctx);
            long ms = elapsedMs(t0);
            stats.addProcessed();
            ItemOutcome o = (r == null)
                    ? ItemOutcome.processFailed(ctx.url(), template.id(), "processor returned no result", content.length(), ms)
                    : ItemOutcome.ok(ctx.url(), r, content.length(), ms);
            if (r == null) stats.addProcessFailure();
            ulog.info("item", "url", ctx.url(),
                    "extraction", "ok",
                    "textLength", content.length(),
                    "fetchMs", fetchMs,
                    "template", template.id(),
                    "processing", o.status().name(),
                    "processingError", o.error(),
                    "elapsedMs", ms);
            return o;
        } catch (ProcessingException e) {
            long ms = elapsedMs(t0);
            stats.addProcessFailure();
            ulog.warn("item", "url", ctx.url(),
                    "extraction", "ok",
                    "textLength", content.length(),
                    "fetchMs", fetchMs,
                    "template", template.id(),
                    "processing", ItemOutcome.Status.PROCESS_FAILED.name(),
                    "processingError", e.getMessage(),
                    "elapsedMs", ms);
            return ItemOutcome.processFailed(ctx.url(), template.id(), e.getMessage(), content.length(), ms);
        }
    }

    /* =========================
       공용 유틸
       ========================= */

    private void checkCancel() {
        if (Thread.currentThread().isInterrupted() || cancel.get()) {
            throw new CancellationException();
        }
    }

    private void onFlushFailure(AtomicReference<CheckpointException> holder, CheckpointException e) {
        if (holder.compareAndSet(null, e)) {
            LOG.error("Checkpoint flush failed, aborting batch: {}", e.toString());
            SLOG.error("checkpoint-flush-failed", e);
            cancel();
        }
    }

    /** 실행 못 한 작업의 Future는 취소해 수집 루프가 기다리지 않게 */
    private static void stopPool(ExecutorService pool) {
        for (Runnable r : pool.shutdownNow()) {
            if (r instanceof Future<?> f) f.cancel(false);
        }
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }
}
