package com.scrapebatch.app.logging;

import com.scrapebatch.core.util.HostInfo;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 10MB x 5)
 * - configure(outRoot): outRoot/logs 기준 초기화
 * - init(logDir): logs 디렉터리를 직접 넘겨 초기화
 * - banner(): PID/호스트/스케줄러 잡 id를 한 번 찍는다(HPC 노드 진단용)
 *
 * System props:
 *  -Dbatch.log.level=FINE|INFO|WARNING|SEVERE
 *  -Dbatch.log.sizeMb=10
 *  -Dbatch.log.files=5
 *  -Dbatch.log.console=true|false (기본 true)
 *  -Dbatch.log.file=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("batch.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("batch.log.sizeMb"), 10);
        int fileCnt = parseInt(System.getProperty("batch.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("batch.log.console", "true"));
        boolean toFile    = !"false".equalsIgnoreCase(System.getProperty("batch.log.file", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        if (toFile) {
            try {
                Files.createDirectories(logDir);
                // 같은 디렉터리를 여러 노드가 쓰므로 파일명에 PID
                String pattern = logDir.resolve("batch-" + ProcessHandle.current().pid() + "-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 마지막 보루: 콘솔에만 찍고 진행
                Logger.getAnonymousLogger().log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
            }
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.INFO,
                () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
    }

    /** 시작 배너: pid, host, SLURM/PBS 잡 id, JVM */
    public static String banner() {
        String line = bannerLine(System.getenv("SLURM_JOB_ID"), System.getenv("SLURM_ARRAY_TASK_ID"),
                System.getenv("PBS_JOBID"));
        Logger.getLogger(LogSetup.class.getName()).info(line);
        return line;
    }

    static String bannerLine(String slurmJob, String slurmTask, String pbsJob) {
        StringBuilder sb = new StringBuilder("scrape-batch start: pid=")
                .append(ProcessHandle.current().pid())
                .append(", host=").append(HostInfo.hostName())
                .append(", java=").append(System.getProperty("java.version"))
                .append(", cpus=").append(Runtime.getRuntime().availableProcessors())
                .append(", maxHeapMb=").append(Runtime.getRuntime().maxMemory() / (1024 * 1024));
        if (slurmJob != null && !slurmJob.isBlank()) {
            sb.append(", slurmJob=").append(slurmJob);
            if (slurmTask != null && !slurmTask.isBlank()) sb.append('_').append(slurmTask);
        }
        if (pbsJob != null && !pbsJob.isBlank()) sb.append(", pbsJob=").append(pbsJob);
        return sb.toString();
    }

    /** 런타임에 로그 레벨 변경 (콘솔/파일 모두) */
    public static void setLevel(Level level) {
        if (level == null) level = Level.INFO;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
