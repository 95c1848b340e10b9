package com.scrapebatch.core.service;

import com.scrapebatch.core.api.FetchException;
import com.scrapebatch.core.api.ItemProcessor;
import com.scrapebatch.core.api.PageFetcher;
import com.scrapebatch.core.api.ProcessingException;
import com.scrapebatch.core.checkpoint.CheckpointStore;
import com.scrapebatch.core.lock.SingleInstanceGuard;
import com.scrapebatch.core.model.BatchConfig;
import com.scrapebatch.core.model.BatchResult;
import com.scrapebatch.core.model.ItemOutcome;
import com.scrapebatch.core.model.ProcessResult;
import com.scrapebatch.core.model.RunReport;
import com.scrapebatch.core.model.RunStatus;
import com.scrapebatch.core.model.Template;
import com.scrapebatch.core.model.UnitResult;
import com.scrapebatch.core.model.WorkUnit;
import com.scrapebatch.core.util.ProgressListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BatchOrchestratorTest {

    @TempDir Path work;

    private BatchConfig cfg;

    private static final List<Template> TEMPLATES = List.of(
            new Template("prompt-1", "Describe $PROJECT"),
            new Template("prompt-2", "License of $PROJECT"),
            new Template("prompt-3", "Language of $PROJECT"));

    /** URL별 fetch 횟수를 세는 가짜 fetcher */
    static class CountingFetcher implements PageFetcher {
        final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        @Override
        public String fetch(String url) throws FetchException, InterruptedException {
            calls.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
            if (url.contains("/missing")) throw new FetchException(url, "HTTP 404");
            return "page of " + url;
        }

        int total() {
            return calls.values().stream().mapToInt(AtomicInteger::get).sum();
        }
    }

    /** 템플릿 id와 콘텐츠 앞부분을 돌려주는 처리기 */
    static final ItemProcessor ECHO = (content, template, ctx) -> new ProcessResult(template.id(),
            Map.of("project", ctx.project(), "template", template.id(), "content", content));

    @BeforeEach
    void setUp() {
        cfg = BatchConfig.defaults()
                .setWorkDir(work)
                .setOutputDir(work.resolve("out"))
                .setConcurrency(2)
                .setWorkers(2)
                .setFetchTimeout(Duration.ofSeconds(10));
        cfg.checkpoint().setFlushInterval(Duration.ofMillis(50)).setFlushEvery(1).setKeep(true);
        cfg.retry().setBaseDelayMs(1);
    }

    private BatchOrchestrator orchestrator(PageFetcher f, ItemProcessor p) {
        return new BatchOrchestrator(cfg, f, p, TEMPLATES, d -> {});
    }

    private static WorkUnit unit(String name, String... urls) {
        return new WorkUnit(name, List.of(urls));
    }

    private static UnitResult done(WorkUnit u) {
        return new UnitResult(u, Instant.parse("2024-06-01T00:00:00Z"), List.of(), Map.of());
    }

    @Test
    @DisplayName("URL 하나는 템플릿 수와 무관하게 한 번만 fetch")
    void each_url_fetched_once_for_all_templates() throws Exception {
        CountingFetcher f = new CountingFetcher();
        AtomicInteger processed = new AtomicInteger();
        ItemProcessor p = (content, template, ctx) -> {
            processed.incrementAndGet();
            return ECHO.process(content, template, ctx);
        };

        BatchResult r = orchestrator(f, p).run("scope", List.of(unit("Alpha", "https://a.example/1", "https://a.example/2")));

        assertThat(r.report().status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(f.calls).hasSize(2);
        assertThat(f.calls.values()).allSatisfy(c -> assertThat(c.get()).isEqualTo(1));
        assertThat(processed.get()).isEqualTo(6);

        UnitResult alpha = r.units().get("Alpha");
        assertThat(alpha.outcomes()).hasSize(6).allMatch(ItemOutcome::isOk);
        assertThat(alpha.merged().get("https://a.example/1"))
                .containsEntry("project", "Alpha")
                .containsEntry("template", List.of("prompt-1", "prompt-2", "prompt-3"));

        // 유닛이 끝나면 캐시 엔트리는 남지 않는다
        try (var s = Files.list(cfg.getCacheDir())) {
            assertThat(s.toList()).isEmpty();
        }
    }

    @Test
    @DisplayName("체크포인트에 A,B가 있으면 재실행은 C만 처리")
    void resume_skips_checkpointed_units() throws Exception {
        WorkUnit a = unit("A", "https://x.example/a");
        WorkUnit b = unit("B", "https://x.example/b");
        WorkUnit c = unit("C", "https://x.example/c");

        CheckpointStore pre = new CheckpointStore(cfg.checkpoint().file());
        pre.record("A", done(a));
        pre.record("B", done(b));
        pre.flush();

        CountingFetcher f = new CountingFetcher();
        BatchResult r = orchestrator(f, ECHO).run("scope", List.of(a, b, c));

        assertThat(f.calls.keySet()).containsExactly("https://x.example/c");
        RunReport report = r.report();
        assertThat(report.skipped()).isEqualTo(2);
        assertThat(report.completed()).containsExactly("C");
        assertThat(report.processed()).isEqualTo(1);
        assertThat(r.units()).containsOnlyKeys("A", "B", "C");
        assertThat(new CheckpointStore(cfg.checkpoint().file()).load()).containsOnlyKeys("A", "B", "C");
    }

    @Test
    @DisplayName("실패한 유닛은 체크포인트에 남지 않고 다음 실행에서 다시 처리")
    void failed_unit_is_retried_next_run() throws Exception {
        WorkUnit good = unit("Good", "https://g.example/");
        WorkUnit bad = unit("Bad", "https://b.example/");
        ItemProcessor explodesOnBad = (content, template, ctx) -> {
            if (ctx.project().equals("Bad")) throw new IllegalStateException("processor bug");
            return ECHO.process(content, template, ctx);
        };

        BatchResult first = orchestrator(new CountingFetcher(), explodesOnBad).run("scope", List.of(good, bad));
        assertThat(first.report().status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(first.report().completed()).containsExactly("Good");
        assertThat(first.report().failed()).singleElement()
                .satisfies(fu -> {
                    assertThat(fu.unit()).isEqualTo("Bad");
                    assertThat(fu.reason()).contains("processor bug");
                });
        assertThat(new CheckpointStore(cfg.checkpoint().file()).load()).containsOnlyKeys("Good");

        CountingFetcher f2 = new CountingFetcher();
        BatchResult second = orchestrator(f2, ECHO).run("scope", List.of(good, bad));
        assertThat(second.report().skipped()).isEqualTo(1);
        assertThat(second.report().completed()).containsExactly("Bad");
        assertThat(f2.calls.keySet()).containsExactly("https://b.example/");
    }

    @Test
    @DisplayName("fetch 실패는 아이템 결과로 남고, 전부 실패하면 유닛 실패")
    void fetch_failures_become_outcomes() throws Exception {
        CountingFetcher f = new CountingFetcher();
        BatchResult r = orchestrator(f, ECHO).run("scope", List.of(
                unit("Partly", "https://p.example/ok", "https://p.example/missing"),
                unit("Nothing", "https://n.example/missing")));

        UnitResult partly = r.units().get("Partly");
        assertThat(partly.outcomes()).hasSize(4);
        assertThat(partly.outcomes()).filteredOn(o -> o.status() == ItemOutcome.Status.FETCH_FAILED)
                .singleElement()
                .satisfies(o -> {
                    assertThat(o.url()).isEqualTo("https://p.example/missing");
                    assertThat(o.error()).contains("HTTP 404");
                });
        assertThat(partly.merged().get("https://p.example/missing")).isEmpty();

        assertThat(r.report().failed()).extracting(RunReport.FailedUnit::unit).containsExactly("Nothing");
        assertThat(r.units()).doesNotContainKey("Nothing");
        assertThat(r.report().stats().fetchFailures).isEqualTo(2);
    }

    @Test
    void processing_exception_marks_item_only() throws Exception {
        ItemProcessor p = (content, template, ctx) -> {
            if (template.id().equals("prompt-2")) throw new ProcessingException("prompt-2", "model refused");
            return ECHO.process(content, template, ctx);
        };

        BatchResult r = orchestrator(new CountingFetcher(), p).run("scope", List.of(unit("U", "https://u.example/")));

        UnitResult u = r.units().get("U");
        assertThat(u.outcomes()).extracting(ItemOutcome::status).containsExactly(
                ItemOutcome.Status.OK, ItemOutcome.Status.PROCESS_FAILED, ItemOutcome.Status.OK);
        assertThat(u.merged().get("https://u.example/").get("template")).isEqualTo(List.of("prompt-1", "prompt-3"));
        assertThat(r.report().failed()).isEmpty();
    }

    @Test
    @DisplayName("같은 scope를 다른 인스턴스가 잡고 있으면 ALREADY_RUNNING")
    void already_running_when_lock_is_held() throws Exception {
        CountingFetcher f = new CountingFetcher();
        try (SingleInstanceGuard other = new SingleInstanceGuard(cfg.getLockDir(), "/data/projects.yml")) {
            assertThat(other.tryAcquire()).isEqualTo(SingleInstanceGuard.Outcome.HELD);

            BatchResult r = orchestrator(f, ECHO).run("/data/projects.yml", List.of(unit("A", "https://a.example/")));

            assertThat(r.report().status()).isEqualTo(RunStatus.ALREADY_RUNNING);
            assertThat(r.report().status().exitCode()).isEqualTo(3);
        }
        assertThat(f.total()).isZero();
        assertThat(Files.exists(cfg.checkpoint().file())).isFalse();
    }

    @Test
    void checkpoint_discarded_when_not_kept_and_all_succeeded() throws Exception {
        cfg.checkpoint().setKeep(false);
        orchestrator(new CountingFetcher(), ECHO).run("scope", List.of(unit("A", "https://a.example/")));
        assertThat(Files.exists(cfg.checkpoint().file())).isFalse();

        // 실패가 있으면 남긴다
        orchestrator(new CountingFetcher(), ECHO).run("scope", List.of(unit("B", "https://b.example/missing")));
        assertThat(Files.exists(cfg.checkpoint().file())).isTrue();
    }

    @Test
    @DisplayName("멈춘 fetch는 제한 시간 뒤 FETCH_FAILED")
    void hung_fetch_times_out() throws Exception {
        cfg.setFetchTimeout(Duration.ofMillis(300));
        PageFetcher f = url -> {
            if (url.contains("/hang")) Thread.sleep(60_000);
            return "fine";
        };

        long t0 = System.nanoTime();
        BatchResult r = orchestrator(f, ECHO).run("scope", List.of(unit("T", "https://t.example/ok", "https://t.example/hang")));
        long tookMs = (System.nanoTime() - t0) / 1_000_000L;

        assertThat(tookMs).isLessThan(30_000);
        assertThat(r.units().get("T").outcomes())
                .filteredOn(o -> o.status() == ItemOutcome.Status.FETCH_FAILED)
                .singleElement()
                .satisfies(o -> assertThat(o.error()).contains("timed out"));
    }

    @Test
    @DisplayName("워커가 많아도 동시 유닛 수는 concurrency 이하")
    void concurrency_is_bounded() throws Exception {
        cfg.setConcurrency(2).setWorkers(6);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        PageFetcher f = url -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(40);
            } finally {
                inFlight.decrementAndGet();
            }
            return "x";
        };

        List<WorkUnit> units = new java.util.ArrayList<>();
        for (int i = 0; i < 12; i++) units.add(unit("U" + i, "https://c.example/" + i));

        BatchResult r = orchestrator(f, ECHO).run("scope", units);

        assertThat(r.report().completed()).hasSize(12);
        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(r.report().stats().maxObservedConcurrency).isLessThanOrEqualTo(2);
    }

    @Test
    void duplicate_units_are_processed_once() throws Exception {
        CountingFetcher f = new CountingFetcher();
        BatchResult r = orchestrator(f, ECHO).run("scope", List.of(
                unit("Dup", "https://d.example/1"), unit("Dup", "https://d.example/2")));

        assertThat(r.report().completed()).containsExactly("Dup");
        assertThat(f.calls.keySet()).containsExactly("https://d.example/1");
    }

    @Test
    void cancelled_before_run_processes_nothing() throws Exception {
        CountingFetcher f = new CountingFetcher();
        BatchOrchestrator o = orchestrator(f, ECHO);
        o.cancel();

        BatchResult r = o.run("scope", List.of(unit("A", "https://a.example/")));

        assertThat(r.report().status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(r.report().status().exitCode()).isEqualTo(1);
        assertThat(f.total()).isZero();
    }

    @Test
    void progress_and_runtime_counters_are_reported() throws Exception {
        List<String> phases = new CopyOnWriteArrayList<>();
        ProgressListener pl = (progress, phase, done, total) -> phases.add(phase + ":" + done + "/" + total);
        BatchOrchestrator o = orchestrator(new CountingFetcher(), ECHO);

        o.run("scope", List.of(unit("A", "https://a.example/"), unit("B", "https://b.example/")), pl);

        assertThat(phases.get(0)).isEqualTo("process:0/2");
        assertThat(phases).contains("done:2/2");
        assertThat(o.getRuntimeSnapshot().fetches).isEqualTo(2);
        assertThat(o.getRuntimeSnapshot().processed).isEqualTo(6);
    }

    @Test
    void repeated_url_in_one_unit_is_fetched_once() throws Exception {
        CountingFetcher f = new CountingFetcher();
        BatchResult r = orchestrator(f, ECHO).run("scope", List.of(
                unit("Twice", "https://t.example/same", "https://t.example/same")));

        assertThat(f.calls.get("https://t.example/same").get()).isEqualTo(1);
        assertThat(r.units().get("Twice").outcomes()).hasSize(3);
    }

    @Test
    @DisplayName("같은 JVM의 두 오케스트레이터가 캐시 디렉터리를 공유해도 서로의 엔트리를 쓰지 않는다")
    void concurrent_orchestrators_sharing_cache_dir_do_not_share_entries() throws Exception {
        BatchConfig cfgB = BatchConfig.defaults()
                .setWorkDir(work.resolve("b"))
                .setCacheDir(cfg.getCacheDir())
                .setConcurrency(1)
                .setWorkers(1);
        cfgB.retry().setBaseDelayMs(1);

        CountDownLatch aHoldsEntry = new CountDownLatch(1);
        CountDownLatch aMayFinish = new CountDownLatch(1);
        ItemProcessor blocking = (content, template, ctx) -> {
            aHoldsEntry.countDown();
            aMayFinish.await(30, TimeUnit.SECONDS);
            return ECHO.process(content, template, ctx);
        };
        WorkUnit shared = unit("Shared", "https://s.example/page");

        ExecutorService side = Executors.newSingleThreadExecutor();
        try {
            Future<BatchResult> a = side.submit(() -> new BatchOrchestrator(cfg, url -> "A-content", blocking,
                    List.of(new Template("prompt-1", "x")), d -> {}).run("/in/a.yml", List.of(shared)));
            assertThat(aHoldsEntry.await(30, TimeUnit.SECONDS)).isTrue();

            AtomicInteger bCalls = new AtomicInteger();
            PageFetcher bFetcher = url -> {
                bCalls.incrementAndGet();
                return "B-content";
            };
            BatchResult b = new BatchOrchestrator(cfgB, bFetcher, ECHO, List.of(new Template("prompt-1", "x")), d -> {})
                    .run("/in/b.yml", List.of(shared));

            assertThat(bCalls.get()).isEqualTo(1);
            assertThat(b.units().get("Shared").merged().get("https://s.example/page"))
                    .containsEntry("content", "B-content");
            assertThat(b.report().stats().diskHits).isZero();

            aMayFinish.countDown();
            BatchResult ra = a.get(30, TimeUnit.SECONDS);
            assertThat(ra.units().get("Shared").merged().get("https://s.example/page"))
                    .containsEntry("content", "A-content");
        } finally {
            aMayFinish.countDown();
            side.shutdownNow();
        }
    }
}
