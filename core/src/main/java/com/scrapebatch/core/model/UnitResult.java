package com.scrapebatch.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 완료된 유닛의 스냅샷 (체크포인트에 그대로 저장).
 * merged: url → field → 값(서로 다른 값이 하나면 String, 여럿이면 List&lt;String&gt;)
 */
public record UnitResult(WorkUnit unit,
                         Instant completedAt,
                         List<ItemOutcome> outcomes,
                         Map<String, Map<String, Object>> merged) {
    public UnitResult {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(completedAt, "completedAt");
        outcomes = (outcomes == null) ? List.of() : List.copyOf(outcomes);
        merged = (merged == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(merged));
    }

    public long failedItems() {
        return outcomes.stream().filter(o -> !o.isOk()).count();
    }
}
