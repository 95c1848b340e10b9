package com.scrapebatch.core.lock;

import com.scrapebatch.core.util.Hashes;
import com.scrapebatch.core.util.HostInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 입력 범위(scope)당 인스턴스 하나만 돌게 하는 OS 레벨 잠금.
 *
 * 잠금 파일: &lt;lockDir&gt;/&lt;slug&gt;-&lt;hash8&gt;.lock
 * - FileChannel.tryLock (비차단). 같은 JVM 안의 중복 시도도 ALREADY_HELD.
 *   JVM 안에서는 경로 집합으로 먼저 거른다(POSIX에선 같은 파일의 다른 fd를 닫으면 잠금이 풀림).
 * - 파일 내용(PID/호스트/시각)은 진단용일 뿐, 잠금 판단에 쓰지 않는다.
 * - 해제해도 파일은 지우지 않는다. 보유 프로세스가 죽으면 OS가 잠금을 푼다.
 */
public final class SingleInstanceGuard implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SingleInstanceGuard.class);

    public enum Outcome { HELD, ALREADY_HELD }

    private static final Set<Path> HELD_IN_JVM = ConcurrentHashMap.newKeySet();

    private final Path lockFile;
    private final String scope;

    private FileChannel channel; // guarded by this
    private FileLock lock;       // guarded by this

    public SingleInstanceGuard(Path lockDir, String scope) {
        Objects.requireNonNull(lockDir, "lockDir");
        Objects.requireNonNull(scope, "scope");
        if (scope.isBlank()) throw new IllegalArgumentException("scope must not be blank");
        this.scope = scope;
        this.lockFile = lockDir.toAbsolutePath().normalize().resolve(lockFileName(scope));
    }

    /** 입력 파일 경로를 scope로 쓰는 편의 생성자(절대경로 기준) */
    public static SingleInstanceGuard forInput(Path lockDir, Path input) {
        return new SingleInstanceGuard(lockDir, input.toAbsolutePath().normalize().toString());
    }

    public Path lockFile() { return lockFile; }

    public synchronized boolean isHeld() { return lock != null && lock.isValid(); }

    /**
     * 비차단 획득 시도. 이미 이 가드가 잡고 있으면 HELD 그대로.
     * @throws IOException 잠금 파일을 열거나 잠글 수 없을 때(실행 중단 사유)
     */
    public synchronized Outcome tryAcquire() throws IOException {
        if (isHeld()) return Outcome.HELD;

        if (!HELD_IN_JVM.add(lockFile)) {
            LOG.info("instance lock busy (same JVM) file={}", lockFile);
            return Outcome.ALREADY_HELD;
        }
        boolean held = false;
        try {
            held = acquireFileLock();
        } finally {
            if (!held) HELD_IN_JVM.remove(lockFile);
        }
        return held ? Outcome.HELD : Outcome.ALREADY_HELD;
    }

    private boolean acquireFileLock() throws IOException {
        Files.createDirectories(lockFile.getParent());
        FileChannel ch = FileChannel.open(lockFile,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        FileLock fl;
        try {
            fl = ch.tryLock();
        } catch (OverlappingFileLockException e) {
            ch.close();
            LOG.info("instance lock busy (same JVM) file={}", lockFile);
            return false;
        } catch (IOException | RuntimeException e) {
            closeAfterFailure(ch, e);
            throw e;
        }
        if (fl == null) {
            ch.close();
            LOG.info("instance lock busy file={}", lockFile);
            return false;
        }

        this.channel = ch;
        this.lock = fl;
        writeDiagnostics(ch);
        LOG.info("instance lock acquired file={} scope={}", lockFile, scope);
        return true;
    }

    /** 여러 번 불러도 안전. 파일은 남겨둔다 */
    public synchronized void release() {
        if (lock == null && channel == null) return;
        try {
            if (lock != null && lock.isValid()) lock.release();
        } catch (IOException e) {
            LOG.warn("instance lock release failed file={} cause={}", lockFile, e.toString());
        } finally {
            lock = null;
            try {
                if (channel != null) channel.close(); // 채널을 닫아도 잠금은 풀린다
            } catch (IOException e) {
                LOG.warn("instance lock channel close failed file={} cause={}", lockFile, e.toString());
            }
            channel = null;
            HELD_IN_JVM.remove(lockFile);
        }
        LOG.info("instance lock released file={}", lockFile);
    }

    @Override
    public void close() {
        release();
    }

    /** slug(입력 파일명 기반) + scope 전체의 sha-256 앞 8자 */
    static String lockFileName(String scope) {
        String last = scope.replace('\\', '/');
        int slash = last.lastIndexOf('/');
        if (slash >= 0) last = last.substring(slash + 1);
        String slug = last.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]+", "_");
        if (slug.length() > 40) slug = slug.substring(0, 40);
        if (slug.isEmpty() || slug.chars().allMatch(c -> c == '_' || c == '.')) slug = "batch";
        return slug + "-" + Hashes.sha256Hex(scope).substring(0, 8) + ".lock";
    }

    private void writeDiagnostics(FileChannel ch) {
        String text = "pid=" + ProcessHandle.current().pid() + "\n"
                + "host=" + HostInfo.hostName() + "\n"
                + "acquiredAt=" + Instant.now() + "\n"
                + "scope=" + scope + "\n";
        try {
            ch.truncate(0);
            ByteBuffer buf = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
            long pos = 0;
            while (buf.hasRemaining()) pos += ch.write(buf, pos);
            ch.force(false);
        } catch (IOException e) {
            // 내용은 진단용: 잠금 자체는 유효
            LOG.warn("lock diagnostics not written file={} cause={}", lockFile, e.toString());
        }
    }

    private static void closeAfterFailure(FileChannel ch, Exception primary) {
        try {
            ch.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
