package com.scrapebatch.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 한 번의 실행 요약.
 * processed = 이번 실행에서 시도한 유닛 수, skipped = 체크포인트 덕에 건너뛴 수.
 */
public record RunReport(RunStatus status,
                        int processed,
                        int skipped,
                        List<String> completed,
                        List<FailedUnit> failed,
                        BatchStats.Snapshot stats,
                        Instant startedAt,
                        Instant finishedAt) {

    /** 실패 유닛 + 사유 (다음 실행에서 재시도 대상) */
    public record FailedUnit(String unit, String reason) {}

    public RunReport {
        Objects.requireNonNull(status, "status");
        completed = (completed == null) ? List.of() : List.copyOf(completed);
        failed = (failed == null) ? List.of() : List.copyOf(failed);
    }

    public static RunReport alreadyRunning(Instant at) {
        return new RunReport(RunStatus.ALREADY_RUNNING, 0, 0, List.of(), List.of(), null, at, at);
    }

    public boolean hasFailures() { return !failed.isEmpty(); }
}
