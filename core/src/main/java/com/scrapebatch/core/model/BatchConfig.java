package com.scrapebatch.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 배치 실행 설정 (batch.yml 매핑 대상). 순수 설정 보관용.
 * Orchestrator 생성 시 한 번 넘기고 협력 객체로 전달한다(전역 상태 없음).
 */
public final class BatchConfig {

    /** 프로젝트(슬롯) 하나가 대략 잡아먹는 메모리. concurrency 자동 산정에 사용 */
    public static final int DEFAULT_MEMORY_PER_SLOT_MB = 75;

    /** 원자적 쓰기 재시도: YAML `retry:` 섹션 */
    public static final class RetryCfg {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;

        public int getMaxAttempts() { return maxAttempts; }
        public RetryCfg setMaxAttempts(int v) { this.maxAttempts = v; return this; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public RetryCfg setBaseDelayMs(long v) { this.baseDelayMs = v; return this; }
    }

    /** 체크포인트: YAML `checkpoint:` 섹션 */
    public static final class CheckpointCfg {
        private Path dir = Path.of("work", "checkpoints");
        /** 주기적 flush 간격 */
        private Duration flushInterval = Duration.ofSeconds(30);
        /** N개 완료마다 추가 flush (0이면 끔) */
        private int flushEvery = 10;
        /** false면 실패 유닛 없이 끝난 경우 체크포인트 삭제 */
        private boolean keep = true;

        public Path getDir() { return dir; }
        public CheckpointCfg setDir(Path v) { this.dir = v; return this; }

        public Duration getFlushInterval() { return flushInterval; }
        public CheckpointCfg setFlushInterval(Duration v) { this.flushInterval = v; return this; }

        public int getFlushEvery() { return flushEvery; }
        public CheckpointCfg setFlushEvery(int v) { this.flushEvery = v; return this; }

        public boolean isKeep() { return keep; }
        public CheckpointCfg setKeep(boolean v) { this.keep = v; return this; }

        public Path file() { return dir.resolve("checkpoint.json"); }
    }

    /** 템플릿 파일: <dir>/<base><n>.txt (n = 1..count) */
    public static final class TemplateCfg {
        private Path dir = Path.of("prompts");
        private String base = "prompt-";
        private int count = 5;

        public Path getDir() { return dir; }
        public TemplateCfg setDir(Path v) { this.dir = v; return this; }

        public String getBase() { return base; }
        public TemplateCfg setBase(String v) { this.base = v; return this; }

        public int getCount() { return count; }
        public TemplateCfg setCount(int v) { this.count = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private Path cacheDir = Path.of("work", "cache");
    private Path lockDir = Path.of("work", "locks");
    private Path outputDir = Path.of("out");

    /** 동시 fetch 슬롯 수. 0 이하이면 메모리/CPU 기준 자동 산정 */
    private int concurrency = 0;
    /** 워커 스레드 수. 0 이하이면 concurrency와 동일 */
    private int workers = 0;
    private int memoryPerSlotMb = DEFAULT_MEMORY_PER_SLOT_MB;

    private Duration fetchTimeout = Duration.ofSeconds(60);
    private boolean followRedirects = true;
    private String userAgent = "scrape-batch/1.0";
    /** fetch 초당 허용 수. 0이면 제한 없음 */
    private double fetchRps = 0;

    private final RetryCfg retry = new RetryCfg();
    private final CheckpointCfg checkpoint = new CheckpointCfg();
    private final TemplateCfg templates = new TemplateCfg();

    // ---------- getters ----------
    public Path getCacheDir() { return cacheDir; }
    public Path getLockDir() { return lockDir; }
    public Path getOutputDir() { return outputDir; }
    public int getConcurrency() { return concurrency; }
    public int getWorkers() { return workers; }
    public int getMemoryPerSlotMb() { return memoryPerSlotMb; }
    public Duration getFetchTimeout() { return fetchTimeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public double getFetchRps() { return fetchRps; }
    public RetryCfg retry() { return retry; }
    public CheckpointCfg checkpoint() { return checkpoint; }
    public TemplateCfg templates() { return templates; }

    // ---------- fluent setters ----------
    public BatchConfig setCacheDir(Path v) { this.cacheDir = v; return this; }
    public BatchConfig setLockDir(Path v) { this.lockDir = v; return this; }
    public BatchConfig setOutputDir(Path v) { this.outputDir = v; return this; }
    public BatchConfig setConcurrency(int v) { this.concurrency = v; return this; }
    public BatchConfig setWorkers(int v) { this.workers = v; return this; }
    public BatchConfig setMemoryPerSlotMb(int v) { this.memoryPerSlotMb = v; return this; }
    public BatchConfig setFetchTimeout(Duration v) { this.fetchTimeout = v; return this; }
    public BatchConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public BatchConfig setUserAgent(String v) { this.userAgent = v; return this; }
    public BatchConfig setFetchRps(double v) { this.fetchRps = v; return this; }

    /** 작업 디렉터리 하나로 cache/locks/checkpoints를 몰아서 지정 */
    public BatchConfig setWorkDir(Path workDir) {
        Objects.requireNonNull(workDir, "workDir");
        this.cacheDir = workDir.resolve("cache");
        this.lockDir = workDir.resolve("locks");
        this.checkpoint.setDir(workDir.resolve("checkpoints"));
        return this;
    }

    /**
     * 실제로 쓰일 슬롯 수.
     * 설정값이 없으면 min(CPU*2, 최대 힙 / 슬롯당 메모리), 최소 1.
     */
    public int effectiveConcurrency() {
        if (concurrency > 0) return concurrency;
        int byCpu = Runtime.getRuntime().availableProcessors() * 2;
        long maxMb = Runtime.getRuntime().maxMemory() / (1024L * 1024L);
        long byMem = Math.max(1, maxMb / Math.max(1, memoryPerSlotMb));
        return (int) Math.max(1, Math.min(byCpu, byMem));
    }

    public int effectiveWorkers() {
        return workers > 0 ? workers : effectiveConcurrency();
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(cacheDir, "cacheDir");
        Objects.requireNonNull(lockDir, "lockDir");
        Objects.requireNonNull(outputDir, "outputDir");
        if (memoryPerSlotMb < 1) throw new IllegalArgumentException("memoryPerSlotMb must be >= 1");
        if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero())
            throw new IllegalArgumentException("fetchTimeout must be > 0");
        if (fetchRps < 0) throw new IllegalArgumentException("fetchRps must be >= 0");
        if (userAgent == null || userAgent.isBlank()) throw new IllegalArgumentException("userAgent must not be blank");

        if (retry.getMaxAttempts() < 1) throw new IllegalArgumentException("retry.maxAttempts must be >= 1");
        if (retry.getBaseDelayMs() < 0) throw new IllegalArgumentException("retry.baseDelayMs must be >= 0");

        Objects.requireNonNull(checkpoint.getDir(), "checkpoint.dir");
        Duration fi = checkpoint.getFlushInterval();
        if (fi == null || fi.isNegative() || fi.isZero())
            throw new IllegalArgumentException("checkpoint.flushInterval must be > 0");
        if (checkpoint.getFlushEvery() < 0) throw new IllegalArgumentException("checkpoint.flushEvery must be >= 0");

        Objects.requireNonNull(templates.getDir(), "templates.dir");
        if (templates.getBase() == null || templates.getBase().isBlank())
            throw new IllegalArgumentException("templates.base must not be blank");
        if (templates.getCount() < 1) throw new IllegalArgumentException("templates.count must be >= 1");
    }

    // ---------- helpers ----------
    public static BatchConfig defaults() { return new BatchConfig(); }
}
