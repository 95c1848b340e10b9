package com.scrapebatch.app.app;

import com.scrapebatch.app.input.TemplateLoader;
import com.scrapebatch.app.input.WorkUnitLoader;
import com.scrapebatch.app.logging.LogSetup;
import com.scrapebatch.app.output.ResultWriter;
import com.scrapebatch.app.process.ProcessorResolver;
import com.scrapebatch.core.checkpoint.CheckpointException;
import com.scrapebatch.core.fetch.JsoupPageFetcher;
import com.scrapebatch.core.model.BatchConfig;
import com.scrapebatch.core.model.BatchResult;
import com.scrapebatch.core.model.RunReport;
import com.scrapebatch.core.model.RunStatus;
import com.scrapebatch.core.model.Template;
import com.scrapebatch.core.model.WorkUnit;
import com.scrapebatch.core.service.BatchOrchestrator;
import com.scrapebatch.core.util.YamlConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 배치 러너.
 *
 * 종료 코드: 0 완료(실패 유닛이 있어도 리포트에 남기고 0), 1 복구 불가 실패,
 * 2 명령행 사용법 오류, 3 같은 입력으로 다른 인스턴스 실행 중.
 */
@Command(
        name = "scrape-batch",
        version = "scrape-batch 1.0.0",
        mixinStandardHelpOptions = true,
        description = "Fetch every project URL once, apply all templates, checkpoint per project."
)
public final class BatchMain implements Callable<Integer> {
    private static final Logger LOG = Logger.getLogger(BatchMain.class.getName());

    public static final int EXIT_FAILURE = 1;

    /** 종료 훅이 마지막 flush/잠금 해제를 기다리는 상한 */
    static final long SHUTDOWN_WAIT_SECONDS = 90;

    @Option(names = {"-c", "--config"}, description = "batch.yml path (default: ${DEFAULT-VALUE})",
            defaultValue = YamlConfigLoader.DEFAULT_FILE)
    Path configFile;

    @Option(names = {"-i", "--input"}, required = true, description = "projects.yml with {name, urls} entries")
    Path input;

    @Option(names = "--keep-checkpoint", negatable = true,
            description = "keep checkpoint.json after a run without failed units (overrides batch.yml)")
    Boolean keepCheckpoint;

    @Option(names = "--dry-run", description = "use the dry-run processor even if a provider is registered")
    boolean dryRun;

    @Option(names = {"-v", "--verbose"}, description = "log at FINE level")
    boolean verbose;

    @Override
    public Integer call() {
        BatchConfig cfg;
        try {
            cfg = YamlConfigLoader.loadOrDefaults(configFile);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Configuration error: " + e.getMessage(), e);
            return EXIT_FAILURE;
        }
        if (keepCheckpoint != null) cfg.checkpoint().setKeep(keepCheckpoint);

        LogSetup.configure(cfg.getOutputDir());
        if (verbose) LogSetup.setLevel(Level.FINE);
        LogSetup.banner();

        // 전역 uncaught 핸들러
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        List<WorkUnit> units;
        List<Template> templates;
        try {
            units = WorkUnitLoader.load(input);
            templates = TemplateLoader.load(cfg.templates());
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Input error: " + e.getMessage(), e);
            return EXIT_FAILURE;
        }

        BatchOrchestrator orchestrator;
        try {
            orchestrator = new BatchOrchestrator(cfg, new JsoupPageFetcher(cfg),
                    ProcessorResolver.resolve(cfg, dryRun), templates);
        } catch (IllegalArgumentException e) {
            LOG.log(Level.SEVERE, "Configuration error: " + e.getMessage(), e);
            return EXIT_FAILURE;
        }

        // SIGTERM(스케줄러 시간 초과 등) → 새 유닛 투입 중단, run()이 flush/잠금 해제를 마칠 때까지 대기
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> awaitShutdown(orchestrator, finished), "batch-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            String scope = input.toAbsolutePath().normalize().toString();
            BatchResult result = orchestrator.run(scope, units);
            RunReport report = result.report();
            if (report.status() == RunStatus.ALREADY_RUNNING) {
                LOG.warning("Another instance is already processing " + scope + "; exiting.");
                return report.status().exitCode();
            }

            Path out = new ResultWriter(cfg.getOutputDir()).write(result);
            LOG.info(() -> "Results written: " + out.toAbsolutePath());
            if (report.hasFailures()) {
                LOG.warning(report.failed().size() + " unit(s) failed and will be retried on the next run: "
                        + report.failed().stream().map(RunReport.FailedUnit::unit).toList());
            }
            return report.status().exitCode();
        } catch (CheckpointException e) {
            LOG.log(Level.SEVERE, "Checkpoint could not be written, aborting: " + e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Batch aborted: " + e.getMessage(), e);
            return EXIT_FAILURE;
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    private static void awaitShutdown(BatchOrchestrator orchestrator, CountDownLatch finished) {
        if (finished.getCount() == 0) return;
        LOG.warning("Shutdown requested: cancelling batch and waiting for the final checkpoint flush");
        orchestrator.cancel();
        try {
            if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOG.severe("Batch did not stop within " + SHUTDOWN_WAIT_SECONDS + "s; exiting without final flush");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM 종료 중: 훅이 이미 돌고 있음
            LOG.fine("shutdown in progress, hook left registered");
        }
    }

    /** 테스트에서 System.exit 없이 종료 코드 확인용 */
    public static int run(String... args) {
        return new CommandLine(new BatchMain()).execute(args);
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }
}
