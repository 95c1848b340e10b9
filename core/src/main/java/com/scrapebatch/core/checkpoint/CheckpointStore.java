package com.scrapebatch.core.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrapebatch.core.model.UnitResult;
import com.scrapebatch.core.retry.DefaultRetryPolicy;
import com.scrapebatch.core.retry.RetryPolicy;
import com.scrapebatch.core.store.FileAtomicStore;
import com.scrapebatch.core.util.DefaultSleeper;
import com.scrapebatch.core.util.Json;
import com.scrapebatch.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 완료된 유닛 기록. 파일 하나(JSON)를 원자적으로 통째로 교체한다.
 *
 * 없거나 깨졌거나 버전이 다르면 빈 상태로 시작(WARN).
 * flush는 잠금 아래에서 복사본을 떠서 직렬화하므로 동시에 record가 들어와도 안전.
 */
public final class CheckpointStore {
    private static final Logger LOG = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path file;
    private final FileAtomicStore store;
    private final ObjectMapper om = Json.mapper();

    private final Object lock = new Object();
    private final Object flushLock = new Object(); // flush끼리 직렬화(오래된 스냅샷이 최신을 덮지 않게)
    private final Map<String, UnitResult> units = new LinkedHashMap<>(); // guarded by lock
    private int pendingSinceFlush = 0;                                  // guarded by lock

    public CheckpointStore(Path file) {
        this(file, new DefaultRetryPolicy(), new DefaultSleeper());
    }

    public CheckpointStore(Path file, RetryPolicy retry, Sleeper sleeper) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        Path dir = this.file.getParent();
        if (dir == null) throw new IllegalArgumentException("checkpoint file needs a parent dir: " + file);
        this.store = new FileAtomicStore(dir, retry, sleeper);
    }

    public Path file() { return file; }

    /** 파일에서 읽어 메모리 상태를 교체. 읽기 실패는 빈 상태 + WARN */
    public Map<String, UnitResult> load() {
        Map<String, UnitResult> loaded = readFile();
        synchronized (lock) {
            units.clear();
            units.putAll(loaded);
            pendingSinceFlush = 0;
        }
        LOG.info("checkpoint loaded file={} units={}", file, loaded.size());
        return Collections.unmodifiableMap(new LinkedHashMap<>(loaded));
    }

    public void record(String unitId, UnitResult result) {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(result, "result");
        synchronized (lock) {
            units.put(unitId, result);
            pendingSinceFlush++;
        }
    }

    public boolean isCompleted(String unitId) {
        synchronized (lock) {
            return units.containsKey(unitId);
        }
    }

    /** 불변 복사본 */
    public Map<String, UnitResult> completed() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(units));
        }
    }

    /** 마지막 flush 이후 기록된 수 */
    public int pendingSinceFlush() {
        synchronized (lock) {
            return pendingSinceFlush;
        }
    }

    /** 현재 상태를 원자적으로 기록. 성공 후엔 기록된 유닛 전부가 load()로 복구된다. */
    public void flush() throws CheckpointException {
        synchronized (flushLock) {
            CheckpointDocument doc = new CheckpointDocument();
            int snapshotPending;
            synchronized (lock) {
                doc.units = new LinkedHashMap<>(units);
                snapshotPending = pendingSinceFlush;
            }
            doc.savedAt = Instant.now();

            String json;
            try {
                json = om.writerWithDefaultPrettyPrinter().writeValueAsString(doc);
            } catch (JsonProcessingException e) {
                throw new CheckpointException("checkpoint serialization failed", e);
            }
            try {
                store.write(file.getFileName().toString(), json);
            } catch (IOException e) {
                throw new CheckpointException("checkpoint flush failed: " + file, e);
            }
            synchronized (lock) {
                // flush 도중 들어온 기록은 다음 flush 대상으로 남긴다
                pendingSinceFlush = Math.max(0, pendingSinceFlush - snapshotPending);
            }
            LOG.debug("checkpoint flushed file={} units={}", file, doc.units.size());
        }
    }

    /** 변경이 있을 때만 flush */
    public boolean flushIfDirty() throws CheckpointException {
        if (pendingSinceFlush() == 0) return false;
        flush();
        return true;
    }

    /** 체크포인트 파일 삭제(메모리 상태도 비움) */
    public boolean discard() throws IOException {
        synchronized (lock) {
            units.clear();
            pendingSinceFlush = 0;
        }
        boolean existed = store.delete(file.getFileName().toString());
        if (existed) LOG.info("checkpoint discarded file={}", file);
        return existed;
    }

    private Map<String, UnitResult> readFile() {
        Optional<String> raw;
        try {
            raw = store.read(file.getFileName().toString());
        } catch (IOException e) {
            LOG.warn("checkpoint unreadable, starting fresh file={} cause={}", file, e.toString());
            return Map.of();
        }
        if (raw.isEmpty()) return Map.of();
        try {
            CheckpointDocument doc = om.readValue(raw.get(), CheckpointDocument.class);
            if (doc.version != CheckpointDocument.CURRENT_VERSION) {
                LOG.warn("checkpoint version {} unsupported (expected {}), starting fresh file={}",
                        doc.version, CheckpointDocument.CURRENT_VERSION, file);
                return Map.of();
            }
            return doc.units == null ? Map.of() : doc.units;
        } catch (IOException | RuntimeException e) {
            LOG.warn("checkpoint corrupt, starting fresh file={} cause={}", file, e.toString());
            return Map.of();
        }
    }
}
