package com.scrapebatch.core.util;

import com.scrapebatch.core.model.BatchConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class YamlConfigLoaderTest {

    @TempDir Path dir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("batch.concurrency");
        System.clearProperty("batch.workers");
        System.clearProperty("batch.fetchTimeoutMs");
        System.clearProperty("batch.keepCheckpoint");
    }

    private Path yml(String text) throws IOException {
        Path p = dir.resolve("batch.yml");
        Files.writeString(p, text, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void parses_all_sections() throws Exception {
        BatchConfig cfg = YamlConfigLoader.load(yml(String.join("\n",
                "workDir: /tmp/w",
                "lockDir: /var/lock/batch",
                "outputDir: results",
                "concurrency: 4",
                "workers: 8",
                "fetchTimeoutMs: 1500",
                "followRedirects: false",
                "userAgent: my-bot/2",
                "fetchRps: 2.5",
                "retry:",
                "  maxAttempts: 5",
                "  baseDelayMs: 200",
                "checkpoint:",
                "  flushIntervalMs: 1000",
                "  flushEvery: 3",
                "  keep: false",
                "templates:",
                "  dir: tpl",
                "  base: q-",
                "  count: 2",
                "")));

        assertEquals(Path.of("/tmp/w/cache"), cfg.getCacheDir());
        assertEquals(Path.of("/var/lock/batch"), cfg.getLockDir());
        assertEquals(Path.of("/tmp/w/checkpoints"), cfg.checkpoint().getDir());
        assertEquals(Path.of("results"), cfg.getOutputDir());
        assertEquals(4, cfg.getConcurrency());
        assertEquals(8, cfg.effectiveWorkers());
        assertEquals(Duration.ofMillis(1500), cfg.getFetchTimeout());
        assertFalse(cfg.isFollowRedirects());
        assertEquals("my-bot/2", cfg.getUserAgent());
        assertEquals(2.5, cfg.getFetchRps(), 1e-9);
        assertEquals(5, cfg.retry().getMaxAttempts());
        assertEquals(200, cfg.retry().getBaseDelayMs());
        assertEquals(Duration.ofSeconds(1), cfg.checkpoint().getFlushInterval());
        assertEquals(3, cfg.checkpoint().getFlushEvery());
        assertFalse(cfg.checkpoint().isKeep());
        assertEquals(Path.of("tpl"), cfg.templates().getDir());
        assertEquals("q-", cfg.templates().getBase());
        assertEquals(2, cfg.templates().getCount());
    }

    @Test
    void empty_file_means_defaults() throws Exception {
        BatchConfig cfg = YamlConfigLoader.load(yml(""));
        assertEquals(0, cfg.getConcurrency());
        assertEquals(Duration.ofSeconds(60), cfg.getFetchTimeout());
        assertTrue(cfg.checkpoint().isKeep());
    }

    @Test
    @DisplayName("-Dbatch.* 가 파일 값을 덮어쓴다")
    void system_properties_override_file() throws Exception {
        System.setProperty("batch.concurrency", "7");
        System.setProperty("batch.fetchTimeoutMs", "250");
        System.setProperty("batch.keepCheckpoint", "false");

        BatchConfig cfg = YamlConfigLoader.load(yml("concurrency: 2\n"));

        assertEquals(7, cfg.getConcurrency());
        assertEquals(Duration.ofMillis(250), cfg.getFetchTimeout());
        assertFalse(cfg.checkpoint().isKeep());
    }

    @Test
    void missing_file_falls_back_to_defaults_only_in_lenient_mode() throws Exception {
        Path nowhere = dir.resolve("nope.yml");
        assertThrows(IOException.class, () -> YamlConfigLoader.load(nowhere));
        assertNotNull(YamlConfigLoader.loadOrDefaults(nowhere));
    }

    @Test
    void broken_yaml_and_invalid_values_are_io_errors() throws Exception {
        assertThrows(IOException.class, () -> YamlConfigLoader.load(yml("concurrency: [1, 2\n")));
        assertThrows(IOException.class, () -> YamlConfigLoader.load(yml("concurrency: many\n")));
        IOException e = assertThrows(IOException.class,
                () -> YamlConfigLoader.load(yml("retry:\n  maxAttempts: 0\n")));
        assertTrue(e.getMessage().contains("maxAttempts"), e.getMessage());
    }

    @Test
    void bad_system_property_is_rejected() {
        System.setProperty("batch.workers", "lots");
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.sysInt("batch.workers", -1));
    }
}
