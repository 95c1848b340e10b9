package com.scrapebatch.core.store;

import com.scrapebatch.core.retry.DefaultRetryPolicy;
import com.scrapebatch.core.retry.RetryPolicy;
import com.scrapebatch.core.util.DefaultSleeper;
import com.scrapebatch.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 공유 파일시스템 디렉터리 하나를 저장소로 쓰는 AtomicStore.
 *
 * 쓰기 순서: 같은 디렉터리에 유일한 임시파일 생성 → 기록 → force(true) → rename 한 번.
 * ATOMIC_MOVE 미지원 FS에서는 REPLACE_EXISTING move로 폴백(경고 1회).
 * IOException은 RetryPolicy에 따라 통째로 재시도하고, 실패한 시도의 임시파일은 매번 지운다.
 * 여러 스레드/프로세스가 같은 디렉터리를 동시에 써도 된다.
 */
public final class FileAtomicStore implements AtomicStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileAtomicStore.class);

    static final String TMP_SUFFIX = ".tmp";

    /** 테스트 훅: 임시파일 → 최종 경로 이동 */
    @FunctionalInterface
    interface Mover {
        void move(Path tmp, Path target) throws IOException;
    }

    private final Path dir;
    private final RetryPolicy retry;
    private final Sleeper sleeper;
    private final Mover mover;
    private final AtomicBoolean fallbackWarned = new AtomicBoolean();

    public FileAtomicStore(Path dir) {
        this(dir, new DefaultRetryPolicy(), new DefaultSleeper());
    }

    public FileAtomicStore(Path dir, RetryPolicy retry, Sleeper sleeper) {
        this(dir, retry, sleeper, null);
    }

    FileAtomicStore(Path dir, RetryPolicy retry, Sleeper sleeper, Mover mover) {
        this.dir = Objects.requireNonNull(dir, "dir").toAbsolutePath().normalize();
        this.retry = Objects.requireNonNull(retry, "retry");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.mover = (mover != null) ? mover : this::atomicMove;
    }

    public Path dir() { return dir; }

    /** 이름이 가리키는 실제 경로 (디렉터리 밖으로 나가는 이름은 거부) */
    public Path pathOf(String name) {
        checkName(name);
        return dir.resolve(name);
    }

    @Override
    public void write(String name, String content) throws IOException {
        Objects.requireNonNull(content, "content");
        Path target = pathOf(name);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                writeOnce(target, bytes);
                if (attempt > 1) LOG.info("durable write succeeded name={} attempt={}", name, attempt);
                return;
            } catch (IOException e) {
                if (!retry.shouldRetry(e, attempt)) {
                    LOG.warn("durable write gave up name={} attempts={} cause={}", name, attempt, e.toString());
                    throw new DurableWriteException(name, attempt, e);
                }
                Duration delay = retry.nextDelay(attempt);
                LOG.warn("durable write failed name={} attempt={} retryInMs={} cause={}",
                        name, attempt, delay.toMillis(), e.toString());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    DurableWriteException dwe = new DurableWriteException(name, attempt, e);
                    dwe.addSuppressed(ie);
                    throw dwe;
                }
            }
        }
    }

    @Override
    public Optional<String> read(String name) throws IOException {
        Path p = pathOf(name);
        try {
            return Optional.of(Files.readString(p, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean delete(String name) throws IOException {
        return Files.deleteIfExists(pathOf(name));
    }

    // ----------------- internals -----------------

    private void writeOnce(Path target, byte[] bytes) throws IOException {
        Files.createDirectories(dir);
        Path tmp = dir.resolve("." + target.getFileName() + "." + UUID.randomUUID() + TMP_SUFFIX);
        try {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) ch.write(buf);
                ch.force(true);
            }
            mover.move(tmp, target);
        } catch (IOException | RuntimeException e) {
            discardTemp(tmp, e);
            throw e;
        }
    }

    private void atomicMove(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            if (fallbackWarned.compareAndSet(false, true)) {
                LOG.warn("ATOMIC_MOVE not supported in {}, falling back to REPLACE_EXISTING", dir);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discardTemp(Path tmp, Exception primary) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            primary.addSuppressed(cleanup);
        }
    }

    private static void checkName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (name.contains("/") || name.contains("\\") || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("invalid store name: " + name);
        }
    }
}
