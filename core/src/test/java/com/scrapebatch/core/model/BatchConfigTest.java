package com.scrapebatch.core.model;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Test;

class BatchConfigTest {

    @Test
    void defaultsAreValid() {
        BatchConfig cfg = BatchConfig.defaults();
        cfg.validate();

        assertThat(cfg.getCacheDir()).isEqualTo(Path.of("work", "cache"));
        assertThat(cfg.getLockDir()).isEqualTo(Path.of("work", "locks"));
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("out"));
        assertThat(cfg.getFetchTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(cfg.retry().getMaxAttempts()).isEqualTo(3);
        assertThat(cfg.retry().getBaseDelayMs()).isEqualTo(1000L);
        assertThat(cfg.checkpoint().file()).isEqualTo(Path.of("work", "checkpoints", "checkpoint.json"));
        assertThat(cfg.checkpoint().isKeep()).isTrue();
        assertThat(cfg.templates().getCount()).isEqualTo(5);
        assertThat(cfg.getFetchRps()).isZero();
    }

    @Test
    void autoConcurrencyIsAtLeastOneAndBoundedByCpu() {
        BatchConfig cfg = BatchConfig.defaults();

        int cc = cfg.effectiveConcurrency();
        assertThat(cc).isBetween(1, Runtime.getRuntime().availableProcessors() * 2);
        assertThat(cfg.effectiveWorkers()).isEqualTo(cc);

        // 슬롯당 메모리를 힙보다 크게 잡으면 1로 떨어진다
        cfg.setMemoryPerSlotMb(Integer.MAX_VALUE);
        assertThat(cfg.effectiveConcurrency()).isEqualTo(1);
    }

    @Test
    void explicitConcurrencyAndWorkersWin() {
        BatchConfig cfg = BatchConfig.defaults().setConcurrency(7).setWorkers(3);
        assertThat(cfg.effectiveConcurrency()).isEqualTo(7);
        assertThat(cfg.effectiveWorkers()).isEqualTo(3);
    }

    @Test
    void workDirMovesCacheLocksAndCheckpoints() {
        BatchConfig cfg = BatchConfig.defaults().setWorkDir(Path.of("/scratch/job1"));

        assertThat(cfg.getCacheDir()).isEqualTo(Path.of("/scratch/job1/cache"));
        assertThat(cfg.getLockDir()).isEqualTo(Path.of("/scratch/job1/locks"));
        assertThat(cfg.checkpoint().getDir()).isEqualTo(Path.of("/scratch/job1/checkpoints"));
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("out")); // 출력은 그대로
    }

    @Test
    void validateRejectsBadValues() {
        assertThrows(IllegalArgumentException.class,
                () -> BatchConfig.defaults().setFetchTimeout(Duration.ZERO).validate());
        assertThrows(IllegalArgumentException.class,
                () -> BatchConfig.defaults().setFetchRps(-1).validate());
        assertThrows(IllegalArgumentException.class, () -> {
            BatchConfig c = BatchConfig.defaults();
            c.retry().setMaxAttempts(0);
            c.validate();
        });
        assertThrows(IllegalArgumentException.class, () -> {
            BatchConfig c = BatchConfig.defaults();
            c.templates().setCount(0);
            c.validate();
        });
        assertThrows(IllegalArgumentException.class, () -> {
            BatchConfig c = BatchConfig.defaults();
            c.checkpoint().setFlushInterval(Duration.ofMillis(-1));
            c.validate();
        });
        assertThrows(NullPointerException.class,
                () -> BatchConfig.defaults().setCacheDir(null).validate());
    }
}
