package com.scrapebatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** run() 반환값: 요약 리포트 + 체크포인트에 있는 모든 완료 유닛(이전 실행분 포함) */
public record BatchResult(RunReport report, Map<String, UnitResult> units) {
    public BatchResult {
        Objects.requireNonNull(report, "report");
        units = (units == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(units));
    }
}
