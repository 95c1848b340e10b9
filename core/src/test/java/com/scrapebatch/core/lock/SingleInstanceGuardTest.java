package com.scrapebatch.core.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SingleInstanceGuardTest {

    @TempDir Path dir;

    @Test
    @DisplayName("같은 scope 두 번 시도 → 하나만 HELD")
    void second_attempt_in_same_jvm_is_rejected() throws Exception {
        try (SingleInstanceGuard first = new SingleInstanceGuard(dir, "/data/projects.yml");
             SingleInstanceGuard second = new SingleInstanceGuard(dir, "/data/projects.yml")) {
            assertEquals(SingleInstanceGuard.Outcome.HELD, first.tryAcquire());
            assertEquals(SingleInstanceGuard.Outcome.ALREADY_HELD, second.tryAcquire());
            assertTrue(first.isHeld());
            assertFalse(second.isHeld());
            // 다시 불러도 HELD 그대로
            assertEquals(SingleInstanceGuard.Outcome.HELD, first.tryAcquire());
        }
    }

    @Test
    void release_allows_reacquire_and_keeps_file() throws Exception {
        SingleInstanceGuard a = new SingleInstanceGuard(dir, "scope-1");
        assertEquals(SingleInstanceGuard.Outcome.HELD, a.tryAcquire());
        a.release();
        a.release();
        assertTrue(Files.exists(a.lockFile()), "lock file is never deleted");

        try (SingleInstanceGuard b = new SingleInstanceGuard(dir, "scope-1")) {
            assertEquals(SingleInstanceGuard.Outcome.HELD, b.tryAcquire());
            String diag = Files.readString(b.lockFile(), StandardCharsets.UTF_8);
            assertTrue(diag.contains("pid=" + ProcessHandle.current().pid()), diag);
            assertTrue(diag.contains("scope=scope-1"), diag);
        }
    }

    @Test
    void different_scopes_do_not_conflict() throws Exception {
        try (SingleInstanceGuard a = new SingleInstanceGuard(dir, "/x/a.yml");
             SingleInstanceGuard b = new SingleInstanceGuard(dir, "/x/b.yml")) {
            assertEquals(SingleInstanceGuard.Outcome.HELD, a.tryAcquire());
            assertEquals(SingleInstanceGuard.Outcome.HELD, b.tryAcquire());
        }
    }

    @Test
    @DisplayName("다른 프로세스가 보유 → ALREADY_HELD, 그 프로세스가 죽으면 다시 획득")
    void lock_held_by_other_process_and_freed_on_death() throws Exception {
        String scope = dir.resolve("projects.yml").toString();
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        ProcessBuilder pb = new ProcessBuilder(java, "-cp", System.getProperty("java.class.path"),
                LockHolderMain.class.getName(), dir.toString(), scope);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process child = pb.start();
        try {
            BufferedReader out = new BufferedReader(new InputStreamReader(child.getInputStream(), StandardCharsets.UTF_8));
            assertEquals("HELD", out.readLine());

            try (SingleInstanceGuard mine = new SingleInstanceGuard(dir, scope)) {
                assertEquals(SingleInstanceGuard.Outcome.ALREADY_HELD, mine.tryAcquire());
            }
        } finally {
            child.destroyForcibly();
            assertTrue(child.waitFor(30, TimeUnit.SECONDS));
        }

        try (SingleInstanceGuard mine = new SingleInstanceGuard(dir, scope)) {
            assertEquals(SingleInstanceGuard.Outcome.HELD, mine.tryAcquire());
        }
    }

    @Test
    void lock_file_name_is_slug_plus_hash() {
        String name = SingleInstanceGuard.lockFileName("/home/me/My Projects.YML");
        assertTrue(name.matches("my_projects\\.yml-[0-9a-f]{8}\\.lock"), name);

        assertNotEquals(SingleInstanceGuard.lockFileName("/a/projects.yml"),
                SingleInstanceGuard.lockFileName("/b/projects.yml"));
        assertTrue(SingleInstanceGuard.lockFileName("///").startsWith("batch-"));
    }

    @Test
    void blank_scope_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new SingleInstanceGuard(dir, " "));
    }
}
