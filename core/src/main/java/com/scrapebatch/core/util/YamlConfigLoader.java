package com.scrapebatch.core.util;

import com.scrapebatch.core.model.BatchConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * batch.yml을 읽어 BatchConfig로 변환. 마지막에 -Dbatch.* 시스템 프로퍼티를 덮어쓴다.
 *
 * 예상 YAML 키:
 * workDir: "work"              # cache/locks/checkpoints 한 번에 (개별 키가 우선)
 * cacheDir: "work/cache"
 * lockDir: "work/locks"
 * outputDir: "out"
 * concurrency: 0               # 0 = 메모리/CPU 기준 자동
 * workers: 0                   # 0 = concurrency와 동일
 * memoryPerSlotMb: 75
 * fetchTimeoutMs: 60000
 * followRedirects: true
 * userAgent: "scrape-batch/1.0"
 * fetchRps: 0                  # 0 = 제한 없음
 *
 * retry:
 *   maxAttempts: 3
 *   baseDelayMs: 1000
 *
 * checkpoint:
 *   dir: "work/checkpoints"
 *   flushIntervalMs: 30000
 *   flushEvery: 10
 *   keep: true
 *
 * templates:
 *   dir: "prompts"
 *   base: "prompt-"
 *   count: 5
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "batch.yml";

    private YamlConfigLoader() {}

    /** 파일이 없으면 기본값(+시스템 프로퍼티)으로 */
    public static BatchConfig loadOrDefaults(Path yamlPath) throws IOException {
        if (yamlPath != null && Files.exists(yamlPath)) return load(yamlPath);
        BatchConfig cfg = BatchConfig.defaults();
        applySystemOverrides(cfg);
        cfg.validate();
        return cfg;
    }

    public static BatchConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("batch.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            BatchConfig cfg = BatchConfig.defaults();

            if (root instanceof Map<?, ?> map) {
                // 1) 평면 키 (workDir 먼저, 개별 디렉터리가 덮어씀)
                setPath(map, "workDir", cfg::setWorkDir);
                setPath(map, "cacheDir", cfg::setCacheDir);
                setPath(map, "lockDir", cfg::setLockDir);
                setPath(map, "outputDir", cfg::setOutputDir);
                setInt(map, "concurrency", cfg::setConcurrency);
                setInt(map, "workers", cfg::setWorkers);
                setInt(map, "memoryPerSlotMb", cfg::setMemoryPerSlotMb);
                setMs(map, "fetchTimeoutMs", cfg::setFetchTimeout);
                setBoolean(map, "followRedirects", cfg::setFollowRedirects);
                setString(map, "userAgent", cfg::setUserAgent);
                setDouble(map, "fetchRps", cfg::setFetchRps);

                // 2) retry.*
                Map<String, Object> retry = getMap(map, "retry");
                if (retry != null) {
                    var r = cfg.retry();
                    setInt(retry, "maxAttempts", r::setMaxAttempts);
                    setLong(retry, "baseDelayMs", r::setBaseDelayMs);
                }

                // 3) checkpoint.*
                Map<String, Object> cp = getMap(map, "checkpoint");
                if (cp != null) {
                    var c = cfg.checkpoint();
                    setPath(cp, "dir", c::setDir);
                    setMs(cp, "flushIntervalMs", c::setFlushInterval);
                    setInt(cp, "flushEvery", c::setFlushEvery);
                    setBoolean(cp, "keep", c::setKeep);
                }

                // 4) templates.*
                Map<String, Object> tp = getMap(map, "templates");
                if (tp != null) {
                    var t = cfg.templates();
                    setPath(tp, "dir", t::setDir);
                    setString(tp, "base", t::setBase);
                    setInt(tp, "count", t::setCount);
                }
            }
            // 비어있거나 단순 스칼라면 defaults 유지

            applySystemOverrides(cfg);
            cfg.validate();
            return cfg;
        } catch (RuntimeException e) {
            // YAML 문법 오류/숫자 파싱 실패 등은 설정 오류로 통일
            throw new IOException("invalid " + yamlPath.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * -Dbatch.concurrency / -Dbatch.workers / -Dbatch.fetchTimeoutMs / -Dbatch.keepCheckpoint
     * (잡 스크립트에서 파일 수정 없이 조정)
     */
    public static void applySystemOverrides(BatchConfig cfg) {
        int cc = sysInt("batch.concurrency", -1);
        if (cc >= 0) cfg.setConcurrency(cc);
        int workers = sysInt("batch.workers", -1);
        if (workers >= 0) cfg.setWorkers(workers);
        int timeoutMs = sysInt("batch.fetchTimeoutMs", -1);
        if (timeoutMs > 0) cfg.setFetchTimeout(Duration.ofMillis(timeoutMs));
        String keep = System.getProperty("batch.keepCheckpoint");
        if (keep != null && !keep.isBlank()) cfg.checkpoint().setKeep(Boolean.parseBoolean(keep.trim()));
    }

    // ------------ helpers ------------
    static int sysInt(String key, int def) {
        String v = System.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("system property " + key + " is not an integer: " + v, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static void setMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
